package com.riskrecon.worker.api;

import com.riskrecon.domain.risk.StopTakeLevels;
import java.math.BigDecimal;

public record StopTakeLevelsResponse(
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    BigDecimal riskRewardRatio,
    boolean meetsMinimumRiskReward) {
  public static StopTakeLevelsResponse from(StopTakeLevels levels) {
    return new StopTakeLevelsResponse(
        levels.stopLoss(),
        levels.takeProfit(),
        levels.riskRewardRatio(),
        levels.meetsMinimumRiskReward());
  }
}
