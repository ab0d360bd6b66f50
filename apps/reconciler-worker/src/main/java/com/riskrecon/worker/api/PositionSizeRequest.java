package com.riskrecon.worker.api;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record PositionSizeRequest(
    @NotBlank String symbol,
    @NotNull @DecimalMin(value = "0.0", inclusive = false) BigDecimal entryPrice,
    @NotNull BigDecimal stopPrice,
    @DecimalMin("0.0") BigDecimal volatility) {}
