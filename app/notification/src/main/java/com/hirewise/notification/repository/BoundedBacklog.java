package com.hirewise.notification.repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity FIFO ring buffer. Appending to a full backlog overwrites the oldest element.
 * Not thread-safe; callers synchronize.
 */
final class BoundedBacklog<T> {

  private final Object[] slots;
  private int head;
  private int size;

  BoundedBacklog(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.slots = new Object[capacity];
  }

  void append(T element) {
    final int tail = (head + size) % slots.length;
    slots[tail] = element;
    if (size == slots.length) {
      head = (head + 1) % slots.length;
    } else {
      size++;
    }
  }

  @SuppressWarnings("unchecked")
  List<T> drain() {
    final List<T> drained = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      final int index = (head + i) % slots.length;
      drained.add((T) slots[index]);
      slots[index] = null;
    }
    head = 0;
    size = 0;
    return drained;
  }

  int size() {
    return size;
  }

  int capacity() {
    return slots.length;
  }
}
