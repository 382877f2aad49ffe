package com.sayou.fabric.component;

import com.sayou.fabric.atom.Atom;
import java.util.List;

/** Folds the transformed atoms into the object handed to the writer. */
public interface Builder extends Component<List<Atom>, Object> {
  default Object build(List<Atom> atoms) {
    return execute(atoms);
  }
}
