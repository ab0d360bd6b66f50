package com.riskrecon.domain.risk;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record LedgerPosition(
    String symbol,
    PositionSide side,
    BigDecimal quantity,
    BigDecimal entryPrice,
    Instant openedAt,
    Map<String, String> metadata) {

  public LedgerPosition {
    Objects.requireNonNull(symbol, "symbol must not be null");
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(quantity, "quantity must not be null");
    Objects.requireNonNull(entryPrice, "entryPrice must not be null");
    Objects.requireNonNull(openedAt, "openedAt must not be null");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public BigDecimal notional() {
    return quantity.multiply(entryPrice);
  }
}
