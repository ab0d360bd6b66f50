package com.riskrecon.worker.api;

import com.riskrecon.domain.risk.PositionSide;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record StopTakeLevelsRequest(
    @NotNull @DecimalMin(value = "0.0", inclusive = false) BigDecimal entryPrice,
    @NotNull PositionSide side,
    @DecimalMin("0.0") BigDecimal volatility) {}
