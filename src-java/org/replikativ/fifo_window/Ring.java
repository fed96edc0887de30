package org.replikativ.fifo_window;

import java.util.*;

/**
 * Growable circular array with O(1) random access, used where an
 * {@link ArrayDeque} would not do: it allows {@code null} elements and
 * indexed reads and writes.
 *
 * Index 0 is the oldest element. Slots are cleared as elements leave.
 */
@SuppressWarnings("unchecked")
class Ring<T> {
  static final int MIN_CAPACITY = 8;

  // Length is always a power of two
  Object[] _items;

  // Physical index of logical element 0
  int _head;

  // >= 0
  int _len;

  Ring() {
    _items = new Object[MIN_CAPACITY];
    _head  = 0;
    _len   = 0;
  }

  int size() {
    return _len;
  }

  boolean isEmpty() {
    return _len == 0;
  }

  T get(int idx) {
    assert 0 <= idx && idx < _len : "idx = " + idx + ", len = " + _len;
    return (T) _items[(_head + idx) & (_items.length - 1)];
  }

  void set(int idx, T item) {
    assert 0 <= idx && idx < _len : "idx = " + idx + ", len = " + _len;
    _items[(_head + idx) & (_items.length - 1)] = item;
  }

  T first() {
    return get(0);
  }

  T last() {
    return get(_len - 1);
  }

  void addLast(T item) {
    if (_len == _items.length) {
      grow();
    }
    _items[(_head + _len) & (_items.length - 1)] = item;
    _len += 1;
  }

  T removeFirst() {
    assert _len > 0;
    T item = (T) _items[_head];
    _items[_head] = null;
    _head = (_head + 1) & (_items.length - 1);
    _len -= 1;
    if (_len == 0) {
      _head = 0;
    }
    return item;
  }

  T removeLast() {
    assert _len > 0;
    int idx = (_head + _len - 1) & (_items.length - 1);
    T item = (T) _items[idx];
    _items[idx] = null;
    _len -= 1;
    if (_len == 0) {
      _head = 0;
    }
    return item;
  }

  private void grow() {
    Object[] items = new Object[_items.length << 1];
    int tail = Math.min(_len, _items.length - _head);
    System.arraycopy(_items, _head, items, 0, tail);
    System.arraycopy(_items, 0, items, tail, _len - tail);
    _items = items;
    _head  = 0;
  }
}
