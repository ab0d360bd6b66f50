package com.riskrecon.worker.reconcile;

import java.util.Objects;

public record PositionKey(String venue, String symbol) {
  public PositionKey {
    Objects.requireNonNull(venue, "venue must not be null");
    Objects.requireNonNull(symbol, "symbol must not be null");
  }
}
