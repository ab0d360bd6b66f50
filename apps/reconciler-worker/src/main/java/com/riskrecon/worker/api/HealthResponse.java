package com.riskrecon.worker.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskrecon.worker.health.HealthSnapshot;
import com.riskrecon.worker.health.TransportStatus;
import java.util.LinkedHashMap;
import java.util.Map;

public record HealthResponse(
    @JsonProperty("breaker") String breaker,
    @JsonProperty("ws") Map<String, WsStatus> ws,
    @JsonProperty("exposicion_pct") double exposurePercentage,
    @JsonProperty("slippage_bps") double slippageBps,
    @JsonProperty("latencia_ms") double latencyMillis,
    @JsonProperty("fill_rate") double fillRate,
    @JsonProperty("ultimo_error") String lastError) {

  public static HealthResponse from(HealthSnapshot snapshot) {
    Map<String, WsStatus> ws = new LinkedHashMap<>();
    for (Map.Entry<String, TransportStatus> entry : snapshot.transports().entrySet()) {
      ws.put(
          entry.getKey(),
          new WsStatus(entry.getValue().state().value(), entry.getValue().pingMillis()));
    }
    return new HealthResponse(
        snapshot.breakerOpen() ? "open" : "closed",
        ws,
        snapshot.exposurePercentage(),
        snapshot.slippageBps(),
        snapshot.latencyMillis(),
        snapshot.fillRate(),
        snapshot.lastError());
  }

  public record WsStatus(
      @JsonProperty("status") String status, @JsonProperty("ping_ms") Double pingMillis) {}
}
