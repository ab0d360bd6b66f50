package com.riskrecon.integration.venue;

import java.math.BigDecimal;

public record VenuePositionSnapshot(
    String symbol, String side, BigDecimal size, BigDecimal averagePrice) {}
