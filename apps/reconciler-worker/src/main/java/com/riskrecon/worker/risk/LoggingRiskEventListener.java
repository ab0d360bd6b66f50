package com.riskrecon.worker.risk;

import com.riskrecon.domain.risk.RiskEvent;
import com.riskrecon.domain.risk.RiskEventListener;
import com.riskrecon.domain.risk.RiskEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingRiskEventListener implements RiskEventListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingRiskEventListener.class);

  @Override
  public void onEvent(RiskEvent event) {
    if (event.type() == RiskEventType.POSITION_SIZING) {
      log.debug(
          "Risk event type={} symbol={} attributes={}",
          event.type(),
          event.symbol(),
          event.attributes());
      return;
    }
    if (event.type() == RiskEventType.TRADE_VALIDATION
        && Boolean.FALSE.equals(event.attributes().get("valid"))) {
      log.warn(
          "Risk event type={} symbol={} attributes={}",
          event.type(),
          event.symbol(),
          event.attributes());
      return;
    }
    log.info(
        "Risk event type={} symbol={} attributes={}",
        event.type(),
        event.symbol(),
        event.attributes());
  }
}
