package com.riskrecon.worker.reconcile;

import java.util.List;

/** Exponentially smoothed slippage in basis points. */
final class SlippageTracker {
  static final double BATCH_WEIGHT = 0.2;

  private double smoothedBps;

  void recordBatch(List<Double> samplesBps) {
    if (samplesBps.isEmpty()) {
      return;
    }
    double batchAverage =
        samplesBps.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    if (smoothedBps == 0.0) {
      smoothedBps = batchAverage;
    } else {
      smoothedBps = (1.0 - BATCH_WEIGHT) * smoothedBps + BATCH_WEIGHT * batchAverage;
    }
  }

  double current() {
    return smoothedBps;
  }
}
