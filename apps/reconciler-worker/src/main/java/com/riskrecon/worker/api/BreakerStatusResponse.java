package com.riskrecon.worker.api;

import com.riskrecon.worker.breaker.BreakerState;
import java.time.Instant;

public record BreakerStatusResponse(
    boolean engaged, String reason, String updatedBy, Instant updatedAt) {
  public static BreakerStatusResponse from(BreakerState state) {
    return new BreakerStatusResponse(
        state.engaged(), state.reason(), state.updatedBy(), state.updatedAt());
  }
}
