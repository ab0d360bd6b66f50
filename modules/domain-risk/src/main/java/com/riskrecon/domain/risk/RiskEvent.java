package com.riskrecon.domain.risk;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record RiskEvent(
    RiskEventType type, String symbol, Map<String, Object> attributes, Instant occurredAt) {

  public RiskEvent {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    attributes =
        attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }
}
