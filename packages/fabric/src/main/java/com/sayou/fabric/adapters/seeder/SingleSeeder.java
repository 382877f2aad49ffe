package com.sayou.fabric.adapters.seeder;

import com.sayou.fabric.component.AbstractSeeder;
import java.util.List;

/** The run source is the only identifier. */
public class SingleSeeder extends AbstractSeeder {
  public static final String NAME = "single";

  public SingleSeeder() {
    super(NAME);
  }

  @Override
  protected List<String> doSeed(String source) {
    return List.of(source.trim());
  }
}
