package com.sayou.fabric.component;

import com.sayou.fabric.registry.Role;
import java.util.List;

public abstract class AbstractGenerator extends AbstractComponent<RawPayload, List<String>>
    implements Generator {

  protected AbstractGenerator(String name) {
    super(name);
  }

  @Override
  public final Role role() {
    return Role.GENERATOR;
  }

  @Override
  protected final List<String> doExecute(RawPayload payload) throws Exception {
    if (payload.isEmpty()) return List.of();
    List<String> discovered = doGenerate(payload);
    return discovered == null ? List.of() : discovered;
  }

  /** Identifiers discovered in a non-empty payload. */
  protected abstract List<String> doGenerate(RawPayload payload) throws Exception;
}
