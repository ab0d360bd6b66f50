package com.riskrecon.worker.api;

import com.riskrecon.domain.risk.RiskMetrics;
import java.math.BigDecimal;
import java.time.Instant;

public record RiskMetricsResponse(
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
  public static RiskMetricsResponse from(RiskMetrics metrics) {
    return new RiskMetricsResponse(
        metrics.currentBalance(),
        metrics.initialBalance(),
        metrics.dailyPnl(),
        metrics.dailyPnlPercentage(),
        metrics.totalPnlPercentage(),
        metrics.openPositions(),
        metrics.riskUtilization(),
        metrics.totalExposure(),
        metrics.exposureRatio(),
        metrics.paperTrading(),
        metrics.lastUpdate());
  }
}
