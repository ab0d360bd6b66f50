package com.riskrecon.domain.risk;

import java.math.BigDecimal;
import java.time.Instant;

public record RiskMetrics(
    BigDecimal currentBalance,
    BigDecimal initialBalance,
    BigDecimal dailyPnl,
    BigDecimal dailyPnlPercentage,
    BigDecimal totalPnlPercentage,
    int openPositions,
    BigDecimal riskUtilization,
    BigDecimal totalExposure,
    BigDecimal exposureRatio,
    boolean paperTrading,
    Instant lastUpdate) {

  public double exposurePercentage() {
    return exposureRatio.doubleValue() * 100.0;
  }
}
