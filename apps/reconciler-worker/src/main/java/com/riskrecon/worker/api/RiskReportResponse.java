package com.riskrecon.worker.api;

import com.riskrecon.domain.risk.PositionHistoryEntry;
import com.riskrecon.domain.risk.RiskEvent;
import com.riskrecon.domain.risk.RiskParameters;
import com.riskrecon.domain.risk.RiskReport;
import java.time.Instant;
import java.util.List;

public record RiskReportResponse(
    RiskParameters parameters,
    RiskMetricsResponse metrics,
    List<PositionHistoryEntry> positionHistory,
    List<RiskEvent> recentEvents,
    Instant generatedAt) {
  public static RiskReportResponse from(RiskReport report) {
    return new RiskReportResponse(
        report.parameters(),
        RiskMetricsResponse.from(report.metrics()),
        report.positionHistory(),
        report.recentEvents(),
        report.generatedAt());
  }
}
