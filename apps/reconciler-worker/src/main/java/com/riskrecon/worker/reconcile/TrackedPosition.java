package com.riskrecon.worker.reconcile;

import com.riskrecon.domain.risk.PositionSide;
import java.math.BigDecimal;
import java.time.Instant;

/** Venue-scoped view of one open position. Size is always positive. */
public record TrackedPosition(
    String venue,
    String symbol,
    PositionSide side,
    BigDecimal size,
    BigDecimal averagePrice,
    BigDecimal markPrice,
    BigDecimal unrealizedPnl,
    Instant updatedAt) {

  public PositionKey key() {
    return new PositionKey(venue, symbol);
  }

  TrackedPosition refresh(
      PositionSide side,
      BigDecimal size,
      BigDecimal averagePrice,
      BigDecimal markPrice,
      BigDecimal unrealizedPnl,
      Instant updatedAt) {
    return new TrackedPosition(
        venue, symbol, side, size, averagePrice, markPrice, unrealizedPnl, updatedAt);
  }
}
