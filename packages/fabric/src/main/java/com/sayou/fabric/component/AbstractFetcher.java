package com.sayou.fabric.component;

import com.sayou.fabric.registry.Role;

public abstract class AbstractFetcher extends AbstractComponent<String, RawPayload>
    implements Fetcher {

  protected AbstractFetcher(String name) {
    super(name);
  }

  @Override
  public final Role role() {
    return Role.FETCHER;
  }

  @Override
  protected void validate(String identifier) {
    if (identifier == null || identifier.isBlank()) {
      throw new IllegalArgumentException("identifier must not be blank");
    }
  }

  @Override
  protected final RawPayload doExecute(String identifier) throws Exception {
    RawPayload payload = doFetch(identifier);
    return payload == null ? RawPayload.empty(identifier) : payload;
  }

  /** Fetch one identifier; {@code null} is treated as an empty payload. */
  protected abstract RawPayload doFetch(String identifier) throws Exception;
}
