package com.riskrecon.worker.api;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record BalanceUpdateRequest(@NotNull @DecimalMin("0.0") BigDecimal balance) {}
