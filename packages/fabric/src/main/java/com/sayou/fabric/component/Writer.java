package com.sayou.fabric.component;

/** Persists one storage unit and reports how many records it wrote. */
public interface Writer extends Component<Object, Integer> {
  default int store(Object unit) {
    Integer written = execute(unit);
    return written == null ? 0 : written;
  }
}
