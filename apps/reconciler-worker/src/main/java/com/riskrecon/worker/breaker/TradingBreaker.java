package com.riskrecon.worker.breaker;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class TradingBreaker implements BreakerSignal {
  private static final Logger log = LoggerFactory.getLogger(TradingBreaker.class);

  private final Clock clock;
  private final AtomicReference<BreakerState> state;

  @Autowired
  public TradingBreaker() {
    this(Clock.systemUTC());
  }

  public TradingBreaker(Clock clock) {
    this.clock = clock;
    this.state = new AtomicReference<>(new BreakerState(false, null, "system", clock.instant()));
  }

  @Override
  public boolean isEngaged() {
    return state.get().engaged();
  }

  public BreakerState state() {
    return state.get();
  }

  public BreakerState engage(String reason, String actor) {
    BreakerState next =
        new BreakerState(true, normalizeReason(reason), normalizeActor(actor), clock.instant());
    state.set(next);
    log.warn("Trading breaker engaged reason={} actor={}", next.reason(), next.updatedBy());
    return next;
  }

  public BreakerState release(String actor) {
    BreakerState next = new BreakerState(false, null, normalizeActor(actor), clock.instant());
    state.set(next);
    log.info("Trading breaker released actor={}", next.updatedBy());
    return next;
  }

  private static String normalizeReason(String reason) {
    if (reason == null || reason.isBlank()) {
      return "manual_engage";
    }
    return reason;
  }

  private static String normalizeActor(String actor) {
    if (actor == null || actor.isBlank()) {
      return "admin";
    }
    return actor;
  }
}
