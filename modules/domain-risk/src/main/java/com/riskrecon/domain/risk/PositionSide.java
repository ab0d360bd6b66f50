package com.riskrecon.domain.risk;

import java.math.BigDecimal;
import java.util.Locale;

public enum PositionSide {
  LONG,
  SHORT;

  public BigDecimal direction() {
    return this == LONG ? BigDecimal.ONE : BigDecimal.ONE.negate();
  }

  public static PositionSide fromVenueSide(String side) {
    if (side == null || side.isBlank()) {
      throw new RiskDomainException("side must not be blank");
    }
    String normalized = side.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "buy", "long" -> LONG;
      case "sell", "short" -> SHORT;
      default -> throw new RiskDomainException("Unsupported position side: " + side);
    };
  }
}
