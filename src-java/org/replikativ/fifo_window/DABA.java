package org.replikativ.fifo_window;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * De-Amortized Banker's Aggregator.
 *
 * Same front/back decomposition as {@link TwoStacks}, but instead of reversing
 * the back stack in one go when the front runs dry, every push and pop moves
 * the reversal forward by one step. Front and back sizes are kept so that
 * the reversal always finishes before the front empties. Every operation,
 * not just the average, is O(1).
 *
 * Entries live in one ring of values and one ring of aggregates, split by
 * {@code 0 <= l <= r <= a <= b <= size}:
 *
 * <pre>
 *   [0, l)     front        agg_i = v_i ⊕ ... ⊕ v_{b-1}
 *   [l, r)     left         agg_i = v_i ⊕ ... ⊕ v_{r-1}
 *   [r, a)     right        agg_i = v_r ⊕ ... ⊕ v_i
 *   [a, b)     accumulated  agg_i = v_i ⊕ ... ⊕ v_{b-1}
 *   [b, size)  back         agg_i = v_b ⊕ ... ⊕ v_i
 * </pre>
 *
 * Between operations {@code l == size - b + 1} (unless empty) and
 * {@code r - l == a - r}.
 */
public class DABA<V> extends AWindow<V> {
  private static final Logger log = LoggerFactory.getLogger(DABA.class);

  public final Ring<V> _values;
  public final Ring<V> _aggs;

  public int _l;
  public int _r;
  public int _a;
  public int _b;

  public DABA(IOperator<V> op) {
    super(op);
    _values = new Ring<>();
    _aggs   = new Ring<>();
  }

  @Override
  public void push(V value) {
    _aggs.addLast(_op.combine(aggB(), value));
    _values.addLast(value);
    _count += 1;
    fixup();
  }

  @Override
  public void pop() {
    if (_count == 0)
      return;
    _values.removeFirst();
    _aggs.removeFirst();
    _count -= 1;
    _l -= 1;
    _r -= 1;
    _a -= 1;
    _b -= 1;
    fixup();
  }

  @Override
  public V query() {
    return _op.combine(aggF(), aggB());
  }

  private V aggF() {
    return _b > 0 ? _aggs.first() : _op.identity();
  }

  private V aggB() {
    return _b < _count ? _aggs.last() : _op.identity();
  }

  private V aggL() {
    return _l < _r ? _aggs.get(_l) : _op.identity();
  }

  private V aggR() {
    return _r < _a ? _aggs.get(_a - 1) : _op.identity();
  }

  private V aggA() {
    return _a < _b ? _aggs.get(_a) : _op.identity();
  }

  private void fixup() {
    if (_b == 0) {
      // front is empty, so back holds at most one element: it becomes the front
      assert _count <= 1 : "count = " + _count;
      _l = _r = _a = _b = _count;
    } else {
      if (_l == _b) {
        flip();
      }
      if (_l == _r) {
        shift();
      } else {
        shrink();
      }
    }
    assert 0 <= _l && _l <= _r && _r <= _a && _a <= _b && _b <= _count
      : "l = " + _l + ", r = " + _r + ", a = " + _a + ", b = " + _b + ", count = " + _count;
    assert _r - _l == _a - _r;
    assert _count == 0 || _l == _count - _b + 1;
  }

  // Old front becomes left, old back becomes right, front and back are empty
  private void flip() {
    log.trace("Flip at front = {}, back = {}", _b, _count - _b);
    _r = _b;
    _l = 0;
    _a = _count;
    _b = _count;
  }

  // Left and right are empty: the oldest accumulated entry joins the front
  private void shift() {
    _l += 1;
    _r += 1;
    _a += 1;
  }

  // Moves the oldest left entry to the front and the newest right entry to accumulated
  private void shrink() {
    V aggA = aggA();
    _aggs.set(_l, _op.combine(_op.combine(aggL(), aggR()), aggA));
    _l += 1;
    _aggs.set(_a - 1, _op.combine(_values.get(_a - 1), aggA));
    _a -= 1;
  }
}
