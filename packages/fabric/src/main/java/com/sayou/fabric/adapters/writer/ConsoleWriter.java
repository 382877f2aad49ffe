package com.sayou.fabric.adapters.writer;

import com.sayou.fabric.component.AbstractWriter;
import com.sayou.fabric.utility.JacksonUtility;

/** Logs one JSON line per unit at INFO. */
public class ConsoleWriter extends AbstractWriter {
  private static final org.slf4j.Logger log =
      com.sayou.fabric.logging.LoggingService.getLogger(ConsoleWriter.class);

  public static final String NAME = "console";

  public ConsoleWriter() {
    super(NAME);
  }

  @Override
  protected int doStore(Object unit) {
    log.info("{}", JacksonUtility.toJson(UnitRecords.toRecord(unit)));
    return 1;
  }
}
