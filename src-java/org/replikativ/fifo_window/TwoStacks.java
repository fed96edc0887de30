package org.replikativ.fifo_window;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Window split into a front stack (oldest element on top) and a back stack
 * (newest element on top). Each entry carries the aggregate of its own stack
 * from the bottom up to itself, so the tops hold the aggregates of whole stacks.
 *
 * push and query are O(1). pop is O(1) amortized: when the front runs dry the
 * whole back stack is reversed onto it.
 */
public class TwoStacks<V> extends AWindow<V> {
  private static final Logger log = LoggerFactory.getLogger(TwoStacks.class);

  // Top is the oldest element. Values are not kept, only
  // _frontAggs[i] = v_i ⊕ v_{i-1} ⊕ ... ⊕ v_0, top of stack first
  public final Ring<V> _frontAggs;

  // Top is the newest element.
  // _backAggs[i] = v_0 ⊕ ... ⊕ v_i
  public final Ring<V> _backValues;
  public final Ring<V> _backAggs;

  public TwoStacks(IOperator<V> op) {
    super(op);
    _frontAggs   = new Ring<>();
    _backValues  = new Ring<>();
    _backAggs    = new Ring<>();
  }

  @Override
  public void push(V value) {
    _backAggs.addLast(_op.combine(backAgg(), value));
    _backValues.addLast(value);
    _count += 1;
  }

  @Override
  public void pop() {
    if (_count == 0)
      return;
    if (_frontAggs.isEmpty()) {
      transfer();
    }
    _frontAggs.removeLast();
    _count -= 1;
  }

  @Override
  public V query() {
    return _op.combine(frontAgg(), backAgg());
  }

  private V frontAgg() {
    return _frontAggs.isEmpty() ? _op.identity() : _frontAggs.last();
  }

  private V backAgg() {
    return _backAggs.isEmpty() ? _op.identity() : _backAggs.last();
  }

  // Reverses the back stack onto the empty front stack
  private void transfer() {
    assert _frontAggs.isEmpty();
    log.trace("Moving {} elements from back to front", _backValues.size());
    while (!_backValues.isEmpty()) {
      V value = _backValues.removeLast();
      _backAggs.removeLast();
      _frontAggs.addLast(_op.combine(value, frontAgg()));
    }
  }
}
