package com.sayou.fabric.component;

import com.sayou.fabric.atom.Atom;
import com.sayou.fabric.registry.Role;
import java.util.List;
import java.util.Objects;

public abstract class AbstractBuilder extends AbstractComponent<List<Atom>, Object>
    implements Builder {

  protected AbstractBuilder(String name) {
    super(name);
  }

  @Override
  public final Role role() {
    return Role.BUILDER;
  }

  @Override
  protected void validate(List<Atom> atoms) {
    if (atoms == null) throw new IllegalArgumentException("atoms must not be null");
    if (atoms.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("atoms must not contain null elements");
    }
  }

  @Override
  protected final Object doExecute(List<Atom> atoms) throws Exception {
    return doBuild(atoms);
  }

  protected abstract Object doBuild(List<Atom> atoms) throws Exception;
}
