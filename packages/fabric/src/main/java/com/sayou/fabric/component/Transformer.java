package com.sayou.fabric.component;

import com.sayou.fabric.atom.Atom;
import java.util.List;

/** Shared capability of the parser, refiner, splitter and mapper roles. */
public interface Transformer extends Component<List<Atom>, List<Atom>> {
  default List<Atom> transform(List<Atom> atoms) {
    return execute(atoms);
  }
}
