package com.riskrecon.worker.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingReconciliationReporter implements ReconciliationReporter {
  private static final Logger log = LoggerFactory.getLogger(LoggingReconciliationReporter.class);

  @Override
  public void cycleCompleted(CycleSummary summary) {
    if (summary.outcome() == CycleOutcome.BREAKER_OPEN) {
      log.info("Reconciliation cycle paused by breaker cycle={}", summary.cycle());
      return;
    }
    log.info(
        "Reconciliation cycle completed cycle={} venues={} failed={} opened={} updated={} closed={} orders={} fills={} ledgerFailures={} durationMs={}",
        summary.cycle(),
        summary.venuesPolled(),
        summary.failedVenues(),
        summary.positionsOpened(),
        summary.positionsUpdated(),
        summary.positionsClosed(),
        summary.ordersSeen(),
        summary.fillsDetected(),
        summary.ledgerFailures(),
        summary.duration().toMillis());
  }

  @Override
  public void cycleFailed(long cycle, RuntimeException error) {
    log.error("Reconciliation cycle failed cycle={}", cycle, error);
  }

  @Override
  public void venueFailed(String venue, String errorCode, String message, Throwable error) {
    log.warn(
        "Venue fetch failed venue={} error={} message={}", venue, errorCode, message, error);
  }

  @Override
  public void ledgerCallFailed(String operation, PositionKey key, RuntimeException error) {
    log.warn(
        "Risk ledger call failed operation={} venue={} symbol={}",
        operation,
        key.venue(),
        key.symbol(),
        error);
  }
}
