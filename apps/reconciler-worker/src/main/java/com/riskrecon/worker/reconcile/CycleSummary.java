package com.riskrecon.worker.reconcile;

import java.time.Duration;
import java.util.List;

public record CycleSummary(
    long cycle,
    CycleOutcome outcome,
    int venuesPolled,
    List<String> failedVenues,
    int positionsOpened,
    int positionsUpdated,
    int positionsClosed,
    int ordersSeen,
    int fillsDetected,
    int ledgerFailures,
    Duration duration) {

  public CycleSummary {
    failedVenues = failedVenues == null ? List.of() : List.copyOf(failedVenues);
  }
}
