package com.riskrecon.worker.api;

import com.riskrecon.worker.breaker.TradingBreaker;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/breaker")
public class BreakerController {
  private final TradingBreaker tradingBreaker;

  public BreakerController(TradingBreaker tradingBreaker) {
    this.tradingBreaker = tradingBreaker;
  }

  @GetMapping
  public BreakerStatusResponse status() {
    return BreakerStatusResponse.from(tradingBreaker.state());
  }

  @PostMapping("/engage")
  public BreakerStatusResponse engage(
      @Valid @RequestBody(required = false) BreakerEngageRequest request) {
    String reason = request == null ? null : request.reason();
    String actor = request == null ? null : request.actor();
    return BreakerStatusResponse.from(tradingBreaker.engage(reason, actor));
  }

  @PostMapping("/release")
  public BreakerStatusResponse release(
      @Valid @RequestBody(required = false) BreakerReleaseRequest request) {
    return BreakerStatusResponse.from(
        tradingBreaker.release(request == null ? null : request.actor()));
  }
}
