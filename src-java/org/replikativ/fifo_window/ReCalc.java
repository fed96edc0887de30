package org.replikativ.fifo_window;

/**
 * Stores the window as is and folds it on every query.
 *
 * push and pop are O(1), query is O(n). Serves as the reference the other
 * algorithms are checked against.
 */
public class ReCalc<V> extends AWindow<V> {
  public final Ring<V> _values;

  public ReCalc(IOperator<V> op) {
    super(op);
    _values = new Ring<>();
  }

  @Override
  public void push(V value) {
    _values.addLast(value);
    _count += 1;
  }

  @Override
  public void pop() {
    if (_count == 0)
      return;
    _values.removeFirst();
    _count -= 1;
  }

  @Override
  public V query() {
    V result = _op.identity();
    for (int i = 0; i < _values.size(); i++) {
      result = _op.combine(result, _values.get(i));
    }
    return result;
  }
}
