package com.sayou.fabric.component;

import com.sayou.fabric.registry.Role;

public abstract class AbstractWriter extends AbstractComponent<Object, Integer> implements Writer {

  protected AbstractWriter(String name) {
    super(name);
  }

  @Override
  public final Role role() {
    return Role.WRITER;
  }

  @Override
  protected final Integer doExecute(Object unit) throws Exception {
    return Math.max(0, doStore(unit));
  }

  /**
   * Persist one unit.
   *
   * @return number of records written for this unit
   */
  protected abstract int doStore(Object unit) throws Exception;
}
