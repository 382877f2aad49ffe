package com.sayou.fabric.resilience;

import com.sayou.fabric.exception.ExceptionUtil;
import com.sayou.fabric.exception.FabricErrorCode;
import com.sayou.fabric.exception.FabricException;

/** A unit of work the resilience wrappers compose around. */
@FunctionalInterface
public interface Operation<T> {
  T call() throws Exception;

  /** Run the operation, surfacing checked errors as {@link FabricException}. */
  default T callUnchecked() {
    try {
      return call();
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          ex ->
              new FabricException(FabricErrorCode.UNKNOWN, ExceptionUtil.describe(ex), ex));
    }
  }
}
