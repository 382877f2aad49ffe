package com.sayou.fabric.component;

import com.sayou.fabric.registry.Role;
import java.util.List;

public abstract class AbstractSeeder extends AbstractComponent<String, List<String>>
    implements Seeder {

  protected AbstractSeeder(String name) {
    super(name);
  }

  @Override
  public final Role role() {
    return Role.SEEDER;
  }

  @Override
  protected void validate(String source) {
    if (source == null || source.isBlank()) {
      throw new IllegalArgumentException("source must not be blank");
    }
  }

  @Override
  protected final List<String> doExecute(String source) throws Exception {
    List<String> seeds = doSeed(source);
    return seeds == null ? List.of() : seeds;
  }

  protected abstract List<String> doSeed(String source) throws Exception;
}
