package com.sayou.fabric.adapters.generator;

import com.sayou.fabric.component.AbstractGenerator;
import com.sayou.fabric.component.RawPayload;
import java.util.List;

/** Never discovers anything; the run fetches its seeds only. */
public class NoneGenerator extends AbstractGenerator {
  public static final String NAME = "none";

  public NoneGenerator() {
    super(NAME);
  }

  @Override
  protected List<String> doGenerate(RawPayload payload) {
    return List.of();
  }
}
