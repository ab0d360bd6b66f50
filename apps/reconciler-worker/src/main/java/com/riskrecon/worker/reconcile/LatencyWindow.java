package com.riskrecon.worker.reconcile;

import com.riskrecon.domain.risk.BoundedHistory;

/** Rolling window of fetch round trips; the oldest sample drops once full. */
final class LatencyWindow {
  private final BoundedHistory<Double> samples;

  LatencyWindow(int capacity) {
    this.samples = new BoundedHistory<>(capacity);
  }

  synchronized void record(double millis) {
    samples.append(millis);
  }

  synchronized double mean() {
    return samples.toList().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
  }

  synchronized int size() {
    return samples.size();
  }
}
