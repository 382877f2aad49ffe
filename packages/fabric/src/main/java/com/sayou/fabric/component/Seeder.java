package com.sayou.fabric.component;

import java.util.List;

/** Turns a run source into the initial identifiers of the frontier. */
public interface Seeder extends Component<String, List<String>> {
  default List<String> seed(String source) {
    return execute(source);
  }
}
