package com.riskrecon.domain.risk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class RiskParametersTest {
  @Test
  void shouldRejectFractionAboveOne() {
    assertThrows(
        RiskDomainException.class,
        () ->
            new RiskParameters(
                new BigDecimal("1.5"),
                new BigDecimal("0.02"),
                new BigDecimal("0.02"),
                new BigDecimal("0.06"),
                3,
                new BigDecimal("2.0"),
                new BigDecimal("0.3"),
                new BigDecimal("0.10"),
                false,
                true));
  }

  @Test
  void shouldRejectZeroMaxOpenPositions() {
    RiskParameters defaults = RiskParameters.defaults();
    assertThrows(
        RiskDomainException.class,
        () ->
            new RiskParameters(
                defaults.maxPositionFraction(),
                defaults.maxDailyLossFraction(),
                defaults.stopLossFraction(),
                defaults.takeProfitFraction(),
                0,
                defaults.minRiskRewardRatio(),
                defaults.maxCorrelatedExposureFraction(),
                defaults.emergencyStopLossFraction(),
                false,
                true));
  }

  @Test
  void shouldMapVenueSidesToPositionSides() {
    assertEquals(PositionSide.LONG, PositionSide.fromVenueSide("buy"));
    assertEquals(PositionSide.LONG, PositionSide.fromVenueSide("LONG"));
    assertEquals(PositionSide.SHORT, PositionSide.fromVenueSide("sell"));
    assertEquals(new BigDecimal("-1"), PositionSide.SHORT.direction());
    assertThrows(RiskDomainException.class, () -> PositionSide.fromVenueSide("flat"));
  }
}
