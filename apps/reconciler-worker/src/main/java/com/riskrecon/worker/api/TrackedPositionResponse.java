package com.riskrecon.worker.api;

import com.riskrecon.worker.reconcile.TrackedPosition;
import java.math.BigDecimal;
import java.time.Instant;

public record TrackedPositionResponse(
    String venue,
    String symbol,
    String side,
    BigDecimal size,
    BigDecimal averagePrice,
    BigDecimal markPrice,
    BigDecimal unrealizedPnl,
    Instant updatedAt) {
  public static TrackedPositionResponse from(TrackedPosition position) {
    return new TrackedPositionResponse(
        position.venue(),
        position.symbol(),
        position.side().name(),
        position.size(),
        position.averagePrice(),
        position.markPrice(),
        position.unrealizedPnl(),
        position.updatedAt());
  }
}
