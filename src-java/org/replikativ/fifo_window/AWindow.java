package org.replikativ.fifo_window;

import java.util.Objects;
import clojure.lang.*;

/**
 * Base class of the window algorithms.
 *
 * Also exposes the window to Clojure: {@code @window} returns the aggregate
 * and {@code (count window)} the number of elements.
 */
public abstract class AWindow<V> implements IFifoWindow<V>, IDeref, Counted {
  public final IOperator<V> _op;

  // >= 0
  public int _count;

  public AWindow(IOperator<V> op) {
    _op    = Objects.requireNonNull(op, "op");
    _count = 0;
  }

  public IOperator<V> operator() {
    return _op;
  }

  @Override
  public int count() {
    return _count;
  }

  @Override
  public Object deref() {
    return query();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{count=" + _count + ", aggregate=" + query() + "}";
  }
}
