package com.riskrecon.worker.api;

import java.math.BigDecimal;

public record PositionSizeResponse(String symbol, BigDecimal quantity) {}
