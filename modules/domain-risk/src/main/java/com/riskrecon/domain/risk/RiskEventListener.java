package com.riskrecon.domain.risk;

/** Receives every event the ledger appends to its audit log, in append order. */
@FunctionalInterface
public interface RiskEventListener {
  void onEvent(RiskEvent event);

  static RiskEventListener noop() {
    return event -> {};
  }
}
