package org.replikativ.fifo_window;

import java.util.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Window partitioned into blocks of at most {@link Settings#blockSize()}
 * elements, each tagged with the aggregate of its elements.
 *
 * The oldest {@code _frontCount} blocks form the front run: each of them also
 * caches the aggregate of itself and all newer front blocks. The remaining
 * blocks form the back run, whose aggregate is kept as a running combine in
 * arrival order. Elements are only ever appended to a back block, so front
 * caches stay valid until the front run is consumed, at which point all
 * blocks are turned into a new front run.
 *
 * push and query are O(1). pop recomputes the oldest block from its remaining
 * elements, O(block size), plus an amortized O(1) share of the rebuilds.
 */
@SuppressWarnings("unchecked")
public class SoE<V> extends AWindow<V> {
  private static final Logger log = LoggerFactory.getLogger(SoE.class);

  public final Settings _settings;

  // Oldest block first
  public final ArrayDeque<Block<V>> _blocks;

  // Number of blocks at the head of _blocks that form the front run
  public int _frontCount;

  // Aggregate of the back run, oldest to newest
  public V _backAgg;

  public SoE(IOperator<V> op) {
    this(op, Settings.DEFAULT);
  }

  public SoE(IOperator<V> op, Settings settings) {
    super(op);
    _settings   = Objects.requireNonNull(settings, "settings");
    _blocks     = new ArrayDeque<>();
    _frontCount = 0;
    _backAgg    = op.identity();
  }

  @Override
  public void push(V value) {
    Block<V> last = _blocks.peekLast();
    // front blocks are sealed, their cached suffixes must not change
    if (last == null || last.full() || _frontCount == _blocks.size()) {
      last = new Block<>(_settings.blockSize(), _op.identity());
      _blocks.addLast(last);
    }
    last.add(value, _op);
    _backAgg = _op.combine(_backAgg, value);
    _count += 1;
  }

  @Override
  public void pop() {
    if (_count == 0)
      return;
    if (_frontCount == 0) {
      rebuild();
    }
    Block<V> first = _blocks.peekFirst();
    first.removeFirst();
    _count -= 1;
    if (first.isEmpty()) {
      _blocks.pollFirst();
      _frontCount -= 1;
    } else {
      first._agg = first.computeAgg(_op);
      first._suffix = _op.combine(first._agg, first._rest);
    }
  }

  @Override
  public V query() {
    V front = _frontCount > 0 ? _blocks.peekFirst()._suffix : _op.identity();
    return _op.combine(front, _backAgg);
  }

  public int blockCount() {
    return _blocks.size();
  }

  // Turns every block into the front run, newest to oldest
  private void rebuild() {
    assert _frontCount == 0;
    log.trace("Rebuilding front run over {} blocks", _blocks.size());
    V acc = _op.identity();
    for (Iterator<Block<V>> it = _blocks.descendingIterator(); it.hasNext(); ) {
      Block<V> block = it.next();
      block._rest   = acc;
      block._suffix = _op.combine(block._agg, acc);
      acc = block._suffix;
    }
    _frontCount = _blocks.size();
    _backAgg = _op.identity();
  }

  /**
   * Contiguous run of elements, valid in [_start, _end).
   */
  public static class Block<V> {
    public final Object[] _values;
    public int _start;
    public int _end;

    // Aggregate of this block's elements
    public V _agg;

    // Front run only: aggregate of all newer front blocks
    public V _rest;

    // Front run only: _agg ⊕ _rest
    public V _suffix;

    public Block(int capacity, V identity) {
      assert capacity > 0;
      _values = new Object[capacity];
      _start  = 0;
      _end    = 0;
      _agg    = identity;
      _rest   = identity;
      _suffix = identity;
    }

    public int len() {
      return _end - _start;
    }

    public boolean isEmpty() {
      return _start == _end;
    }

    public boolean full() {
      return _end == _values.length;
    }

    public void add(V value, IOperator<V> op) {
      assert !full();
      _values[_end] = value;
      _end += 1;
      _agg = op.combine(_agg, value);
    }

    public void removeFirst() {
      assert !isEmpty();
      _values[_start] = null;
      _start += 1;
    }

    public V computeAgg(IOperator<V> op) {
      V result = op.identity();
      for (int i = _start; i < _end; i++) {
        result = op.combine(result, (V) _values[i]);
      }
      return result;
    }
  }
}
