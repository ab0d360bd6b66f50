package com.riskrecon.worker.health;

import java.util.Objects;

public record TransportStatus(TransportState state, Double pingMillis) {
  public TransportStatus {
    Objects.requireNonNull(state, "state must not be null");
  }

  public static TransportStatus up(Double pingMillis) {
    return new TransportStatus(TransportState.UP, pingMillis);
  }

  public static TransportStatus down() {
    return new TransportStatus(TransportState.DOWN, null);
  }

  public static TransportStatus unknown() {
    return new TransportStatus(TransportState.UNKNOWN, null);
  }
}
