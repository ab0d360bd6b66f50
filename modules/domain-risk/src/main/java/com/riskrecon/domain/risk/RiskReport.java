package com.riskrecon.domain.risk;

import java.time.Instant;
import java.util.List;

public record RiskReport(
    RiskParameters parameters,
    RiskMetrics metrics,
    List<PositionHistoryEntry> positionHistory,
    List<RiskEvent> recentEvents,
    Instant generatedAt) {

  public RiskReport {
    positionHistory = List.copyOf(positionHistory);
    recentEvents = List.copyOf(recentEvents);
  }
}
