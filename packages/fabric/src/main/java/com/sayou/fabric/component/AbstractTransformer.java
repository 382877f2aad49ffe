package com.sayou.fabric.component;

import com.sayou.fabric.atom.Atom;
import com.sayou.fabric.registry.Role;
import java.util.List;
import java.util.Objects;

/**
 * Base for the four transformer roles. The role is fixed per subclass through the constructor,
 * e.g. {@code super(name, Role.SPLITTER)}.
 */
public abstract class AbstractTransformer extends AbstractComponent<List<Atom>, List<Atom>>
    implements Transformer {
  private final Role role;

  protected AbstractTransformer(String name, Role role) {
    super(name);
    if (role.capability() != Transformer.class) {
      throw new IllegalArgumentException(
          "Role '%s' is not a transformer role".formatted(role.id()));
    }
    this.role = role;
  }

  @Override
  public final Role role() {
    return role;
  }

  @Override
  protected void validate(List<Atom> atoms) {
    if (atoms == null) throw new IllegalArgumentException("atoms must not be null");
    if (atoms.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("atoms must not contain null elements");
    }
  }

  @Override
  protected final List<Atom> doExecute(List<Atom> atoms) throws Exception {
    List<Atom> out = doTransform(atoms);
    return out == null ? List.of() : List.copyOf(out);
  }

  protected abstract List<Atom> doTransform(List<Atom> atoms) throws Exception;
}
