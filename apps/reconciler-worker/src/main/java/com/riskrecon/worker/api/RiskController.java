package com.riskrecon.worker.api;

import com.riskrecon.domain.risk.LedgerPosition;
import com.riskrecon.domain.risk.MarketConditions;
import com.riskrecon.domain.risk.RiskEvent;
import com.riskrecon.domain.risk.RiskLedger;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/risk")
public class RiskController {
  private static final int MAX_EVENT_LIMIT = 1000;

  private final RiskLedger riskLedger;

  public RiskController(RiskLedger riskLedger) {
    this.riskLedger = riskLedger;
  }

  @GetMapping("/metrics")
  public RiskMetricsResponse metrics() {
    return RiskMetricsResponse.from(riskLedger.metrics());
  }

  @GetMapping("/report")
  public RiskReportResponse report() {
    return RiskReportResponse.from(riskLedger.exportReport());
  }

  @GetMapping("/positions")
  public List<LedgerPosition> positions() {
    return riskLedger.openPositions();
  }

  @GetMapping("/events")
  public List<RiskEvent> events(@RequestParam(defaultValue = "50") int limit) {
    if (limit < 1 || limit > MAX_EVENT_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_EVENT_LIMIT);
    }
    return riskLedger.recentEvents(limit);
  }

  @PostMapping("/validate")
  public TradeValidationResponse validate(@Valid @RequestBody ValidateTradeRequest request) {
    MarketConditions conditions =
        new MarketConditions(
            Boolean.TRUE.equals(request.highVolatility()),
            Boolean.TRUE.equals(request.lowLiquidity()));
    return TradeValidationResponse.from(
        riskLedger.validateTrade(
            request.symbol(), request.side(), request.quantity(), request.price(), conditions));
  }

  @PostMapping("/position-size")
  public PositionSizeResponse positionSize(@Valid @RequestBody PositionSizeRequest request) {
    BigDecimal quantity =
        riskLedger.sizePosition(
            request.symbol(), request.entryPrice(), request.stopPrice(), request.volatility());
    return new PositionSizeResponse(request.symbol(), quantity);
  }

  @PostMapping("/levels")
  public StopTakeLevelsResponse levels(@Valid @RequestBody StopTakeLevelsRequest request) {
    return StopTakeLevelsResponse.from(
        riskLedger.stopTakeLevels(request.entryPrice(), request.side(), request.volatility()));
  }

  @PostMapping("/balance")
  public RiskMetricsResponse updateBalance(@Valid @RequestBody BalanceUpdateRequest request) {
    riskLedger.updateBalance(request.balance());
    return RiskMetricsResponse.from(riskLedger.metrics());
  }
}
