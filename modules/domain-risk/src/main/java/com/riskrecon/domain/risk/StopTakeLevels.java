package com.riskrecon.domain.risk;

import java.math.BigDecimal;

public record StopTakeLevels(
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    BigDecimal riskRewardRatio,
    boolean meetsMinimumRiskReward) {}
