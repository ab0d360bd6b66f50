package com.riskrecon.worker.health;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Telemetry published once per reconciliation cycle. Replaced wholesale, never mutated.
 *
 * @param transports per-venue transport status in registration order
 * @param fillRate fills over orders seen since start
 */
public record HealthSnapshot(
    boolean breakerOpen,
    Map<String, TransportStatus> transports,
    double exposurePercentage,
    double slippageBps,
    double latencyMillis,
    double fillRate,
    String lastError,
    long cycle,
    Instant updatedAt) {

  public HealthSnapshot {
    transports =
        transports == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(transports));
  }

  public static HealthSnapshot initial(Instant now) {
    return new HealthSnapshot(false, Map.of(), 0.0, 0.0, 0.0, 0.0, null, 0L, now);
  }

  public HealthSnapshot withBreaker(boolean open, long cycle, Instant now) {
    return new HealthSnapshot(
        open,
        transports,
        exposurePercentage,
        slippageBps,
        latencyMillis,
        fillRate,
        lastError,
        cycle,
        now);
  }
}
