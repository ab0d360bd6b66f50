package com.riskrecon.worker.risk;

import com.riskrecon.domain.risk.RiskLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "risk.daily-reset",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class DailyRiskResetScheduler {
  private static final Logger log = LoggerFactory.getLogger(DailyRiskResetScheduler.class);

  private final RiskLedger riskLedger;

  public DailyRiskResetScheduler(RiskLedger riskLedger) {
    this.riskLedger = riskLedger;
  }

  @Scheduled(cron = "${risk.daily-reset.cron:0 0 0 * * *}", zone = "${risk.daily-reset.zone:UTC}")
  public void runScheduled() {
    riskLedger.resetDaily();
    log.info("Daily risk counters reset");
  }
}
