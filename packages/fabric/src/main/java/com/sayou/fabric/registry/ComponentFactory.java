package com.sayou.fabric.registry;

import com.sayou.fabric.component.Component;

/**
 * Creates fresh, uninitialized component instances. A factory is called once per pipeline run and
 * again whenever a failed instance has to be rebuilt, so it must not hand out shared instances.
 */
@FunctionalInterface
public interface ComponentFactory<C extends Component<?, ?>> {
  C create();
}
