package com.riskrecon.integration.venue;

import java.math.BigDecimal;
import java.time.Instant;

public record VenueTicker(
    String symbol, BigDecimal last, BigDecimal bid, BigDecimal ask, Instant timestamp) {}
