package com.riskrecon.worker.reconcile;

import java.util.Locale;

public enum CycleOutcome {
  COMPLETED,
  BREAKER_OPEN,
  SKIPPED,
  FAILED;

  public String metricTag() {
    return switch (this) {
      case COMPLETED -> "success";
      case BREAKER_OPEN -> "breaker_open";
      case SKIPPED -> "skipped";
      case FAILED -> "failure";
    };
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
