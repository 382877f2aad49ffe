package com.sayou.fabric.adapters.transform;

import com.sayou.fabric.atom.Atom;
import com.sayou.fabric.component.AbstractTransformer;
import com.sayou.fabric.registry.Role;
import java.util.List;

/** Identity transformation, available under every transformer role. */
public class PassthroughTransformer extends AbstractTransformer {
  public static final String NAME = "passthrough";

  public PassthroughTransformer(Role role) {
    super(NAME, role);
  }

  @Override
  protected List<Atom> doTransform(List<Atom> atoms) {
    return atoms;
  }
}
