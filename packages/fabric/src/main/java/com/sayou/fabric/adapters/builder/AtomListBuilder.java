package com.sayou.fabric.adapters.builder;

import com.sayou.fabric.atom.Atom;
import com.sayou.fabric.component.AbstractBuilder;
import java.util.List;

/** The built object is the atom list itself; the writer stores one atom per unit. */
public class AtomListBuilder extends AbstractBuilder {
  public static final String NAME = "atom_list";

  public AtomListBuilder() {
    super(NAME);
  }

  @Override
  protected Object doBuild(List<Atom> atoms) {
    return List.copyOf(atoms);
  }
}
