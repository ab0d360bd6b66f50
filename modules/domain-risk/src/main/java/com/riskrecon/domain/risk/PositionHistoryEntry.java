package com.riskrecon.domain.risk;

import java.math.BigDecimal;
import java.time.Instant;

public record PositionHistoryEntry(
    String symbol,
    PositionAction action,
    PositionSide side,
    BigDecimal quantity,
    BigDecimal entryPrice,
    BigDecimal exitPrice,
    BigDecimal realizedPnl,
    Instant recordedAt) {

  static PositionHistoryEntry opened(LedgerPosition position) {
    return new PositionHistoryEntry(
        position.symbol(),
        PositionAction.OPEN,
        position.side(),
        position.quantity(),
        position.entryPrice(),
        null,
        null,
        position.openedAt());
  }

  static PositionHistoryEntry closed(
      LedgerPosition position, BigDecimal exitPrice, BigDecimal realizedPnl, Instant closedAt) {
    return new PositionHistoryEntry(
        position.symbol(),
        PositionAction.CLOSE,
        position.side(),
        position.quantity(),
        position.entryPrice(),
        exitPrice,
        realizedPnl,
        closedAt);
  }
}
