package com.riskrecon.worker.reconcile;

public interface ReconciliationReporter {
  void cycleCompleted(CycleSummary summary);

  void cycleFailed(long cycle, RuntimeException error);

  void venueFailed(String venue, String errorCode, String message, Throwable error);

  void ledgerCallFailed(String operation, PositionKey key, RuntimeException error);
}
