package com.riskrecon.domain.risk;

import java.math.BigDecimal;
import java.util.Objects;

public record RiskParameters(
    BigDecimal maxPositionFraction,
    BigDecimal maxDailyLossFraction,
    BigDecimal stopLossFraction,
    BigDecimal takeProfitFraction,
    int maxOpenPositions,
    BigDecimal minRiskRewardRatio,
    BigDecimal maxCorrelatedExposureFraction,
    BigDecimal emergencyStopLossFraction,
    boolean paperTrading,
    boolean volatilityAdjustment) {

  public RiskParameters {
    requireFraction(maxPositionFraction, "maxPositionFraction");
    requireFraction(maxDailyLossFraction, "maxDailyLossFraction");
    requireFraction(stopLossFraction, "stopLossFraction");
    requirePositive(takeProfitFraction, "takeProfitFraction");
    requireFraction(maxCorrelatedExposureFraction, "maxCorrelatedExposureFraction");
    requireFraction(emergencyStopLossFraction, "emergencyStopLossFraction");
    requirePositive(minRiskRewardRatio, "minRiskRewardRatio");
    if (maxOpenPositions <= 0) {
      throw new RiskDomainException("maxOpenPositions must be > 0");
    }
  }

  public static RiskParameters defaults() {
    return new RiskParameters(
        new BigDecimal("0.05"),
        new BigDecimal("0.02"),
        new BigDecimal("0.02"),
        new BigDecimal("0.06"),
        3,
        new BigDecimal("2.0"),
        new BigDecimal("0.3"),
        new BigDecimal("0.10"),
        false,
        true);
  }

  private static void requireFraction(BigDecimal value, String name) {
    requirePositive(value, name);
    if (value.compareTo(BigDecimal.ONE) > 0) {
      throw new RiskDomainException(name + " must be <= 1");
    }
  }

  private static void requirePositive(BigDecimal value, String name) {
    Objects.requireNonNull(value, name + " must not be null");
    if (value.signum() <= 0) {
      throw new RiskDomainException(name + " must be > 0");
    }
  }
}
