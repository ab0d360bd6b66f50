package com.riskrecon.domain.risk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fixed-capacity ring buffer. Once full, every append overwrites the oldest entry.
 *
 * <p>Not thread-safe; the owning ledger serializes access.
 */
public final class BoundedHistory<T> {
  private final List<T> slots;
  private int next;
  private int size;

  public BoundedHistory(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.slots = new ArrayList<>(Collections.nCopies(capacity, null));
  }

  public void append(T item) {
    slots.set(next, item);
    next = (next + 1) % slots.size();
    if (size < slots.size()) {
      size++;
    }
  }

  public int size() {
    return size;
  }

  public int capacity() {
    return slots.size();
  }

  /** Returns up to {@code limit} most recent entries, oldest first. */
  public List<T> latest(int limit) {
    int count = Math.min(Math.max(0, limit), size);
    List<T> result = new ArrayList<>(count);
    int start = Math.floorMod(next - count, slots.size());
    for (int i = 0; i < count; i++) {
      result.add(slots.get((start + i) % slots.size()));
    }
    return result;
  }

  public List<T> toList() {
    return latest(size);
  }
}
