package com.riskrecon.domain.risk;

import java.math.BigDecimal;
import java.util.List;

/**
 * Scales the risk budget of a new position by how correlated it is with what is already open.
 * A factor of 1 leaves the budget untouched.
 */
@FunctionalInterface
public interface CorrelationAdjuster {
  BigDecimal adjustmentFor(String symbol, List<LedgerPosition> openPositions);

  static CorrelationAdjuster none() {
    return (symbol, openPositions) -> BigDecimal.ONE;
  }
}
