package org.replikativ.fifo_window;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Window kept as a forest of perfect binary combining trees. Every node caches
 * the aggregate of the elements it covers, and a mutation only repairs the
 * caches it touches instead of recomputing the window.
 *
 * Roots are held on two stacks:
 * <ul>
 *   <li>back: newest root on top, levels strictly decreasing towards the top
 *       like the digits of a binary counter. Each entry caches the aggregate
 *       of all back roots up to itself.</li>
 *   <li>front: oldest root on top. Each entry caches the aggregate of itself
 *       and all newer front roots.</li>
 * </ul>
 *
 * push merges equal-level roots, O(1) amortized. pop splits the oldest root
 * along its left spine down to a leaf; every node is split at most once, so
 * pop is O(1) amortized too. query is O(1).
 */
public class Reactive<V> extends AWindow<V> {
  private static final Logger log = LoggerFactory.getLogger(Reactive.class);

  // Oldest root on top
  public final Ring<Node<V>> _frontNodes;
  public final Ring<V> _frontAggs;

  // Newest root on top
  public final Ring<Node<V>> _backNodes;
  public final Ring<V> _backAggs;

  public Reactive(IOperator<V> op) {
    super(op);
    _frontNodes = new Ring<>();
    _frontAggs  = new Ring<>();
    _backNodes  = new Ring<>();
    _backAggs   = new Ring<>();
  }

  @Override
  public void push(V value) {
    Node<V> carry = new Node<>(value);
    while (!_backNodes.isEmpty() && _backNodes.last()._level == carry._level) {
      Node<V> older = _backNodes.removeLast();
      _backAggs.removeLast();
      carry = new Node<>(older, carry, _op.combine(older._agg, carry._agg));
    }
    _backAggs.addLast(_op.combine(backAgg(), carry._agg));
    _backNodes.addLast(carry);
    _count += 1;
  }

  @Override
  public void pop() {
    if (_count == 0)
      return;
    if (_frontNodes.isEmpty()) {
      transfer();
    }
    Node<V> node = _frontNodes.removeLast();
    _frontAggs.removeLast();
    // walk the left spine, the right halves become front roots
    while (!node.isLeaf()) {
      pushFront(node._right);
      node = node._left;
    }
    _count -= 1;
  }

  @Override
  public V query() {
    return _op.combine(frontAgg(), backAgg());
  }

  public int rootCount() {
    return _frontNodes.size() + _backNodes.size();
  }

  private V frontAgg() {
    return _frontAggs.isEmpty() ? _op.identity() : _frontAggs.last();
  }

  private V backAgg() {
    return _backAggs.isEmpty() ? _op.identity() : _backAggs.last();
  }

  private void pushFront(Node<V> node) {
    _frontAggs.addLast(_op.combine(node._agg, frontAgg()));
    _frontNodes.addLast(node);
  }

  // Back roots, newest first, onto the empty front
  private void transfer() {
    assert _frontNodes.isEmpty();
    log.trace("Moving {} roots from back to front", _backNodes.size());
    while (!_backNodes.isEmpty()) {
      Node<V> node = _backNodes.removeLast();
      _backAggs.removeLast();
      pushFront(node);
    }
  }

  /**
   * Node of a perfect combining tree. A leaf holds one element as its
   * aggregate; a branch at level {@code k} covers {@code 2^k} elements.
   */
  public static class Node<V> {
    // 0 for leaves, 1+ for branches
    public final int _level;

    public final V _agg;

    // Null for leaves
    public final Node<V> _left;
    public final Node<V> _right;

    public Node(V value) {
      _level = 0;
      _agg   = value;
      _left  = null;
      _right = null;
    }

    public Node(Node<V> left, Node<V> right, V agg) {
      assert left._level == right._level;
      _level = left._level + 1;
      _agg   = agg;
      _left  = left;
      _right = right;
    }

    public boolean isLeaf() {
      return _level == 0;
    }

    public long size() {
      return 1L << _level;
    }
  }
}
