package com.sayou.fabric.component;

/** Lifecycle of a component instance. A {@code FAILED} instance is never reused. */
public enum ComponentState {
  UNINITIALIZED,
  READY,
  FAILED
}
