package com.riskrecon.worker.api;

import com.riskrecon.domain.risk.PositionSide;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record ValidateTradeRequest(
    @NotBlank String symbol,
    @NotNull PositionSide side,
    @NotNull @DecimalMin(value = "0.0", inclusive = false) BigDecimal quantity,
    @NotNull @DecimalMin(value = "0.0", inclusive = false) BigDecimal price,
    Boolean highVolatility,
    Boolean lowLiquidity) {}
