package com.riskrecon.worker.breaker;

/** External pause switch. While engaged, reconciliation keeps observing but applies nothing. */
@FunctionalInterface
public interface BreakerSignal {
  boolean isEngaged();
}
