package com.riskrecon.worker.risk;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.riskrecon.domain.risk.RiskLedger;
import org.junit.jupiter.api.Test;

class DailyRiskResetSchedulerTest {
  @Test
  void shouldResetLedgerDailyCounters() {
    RiskLedger riskLedger = mock(RiskLedger.class);
    DailyRiskResetScheduler scheduler = new DailyRiskResetScheduler(riskLedger);

    scheduler.runScheduled();

    verify(riskLedger).resetDaily();
  }
}
