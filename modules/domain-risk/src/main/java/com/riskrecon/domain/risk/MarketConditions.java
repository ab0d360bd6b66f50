package com.riskrecon.domain.risk;

public record MarketConditions(boolean highVolatility, boolean lowLiquidity) {
  public static MarketConditions normal() {
    return new MarketConditions(false, false);
  }
}
