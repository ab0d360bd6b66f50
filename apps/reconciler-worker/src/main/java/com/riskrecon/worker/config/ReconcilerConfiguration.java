package com.riskrecon.worker.config;

import com.riskrecon.domain.risk.CorrelationAdjuster;
import com.riskrecon.domain.risk.InMemoryRiskLedger;
import com.riskrecon.domain.risk.RiskLedger;
import com.riskrecon.integration.venue.PaperVenueAdapter;
import com.riskrecon.integration.venue.VenueAdapter;
import com.riskrecon.integration.venue.VenueRegistry;
import com.riskrecon.worker.risk.LoggingRiskEventListener;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
  ReconcilerProperties.class,
  RiskProperties.class,
  VenueProperties.class
})
public class ReconcilerConfiguration {
  private static final Logger log = LoggerFactory.getLogger(ReconcilerConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public Clock reconcilerClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public CorrelationAdjuster correlationAdjuster() {
    return CorrelationAdjuster.none();
  }

  @Bean
  @ConditionalOnMissingBean
  public RiskLedger riskLedger(
      RiskProperties properties, Clock reconcilerClock, CorrelationAdjuster correlationAdjuster) {
    InMemoryRiskLedger ledger =
        new InMemoryRiskLedger(
            properties.getInitialBalance(),
            properties.getParameters().toRiskParameters(),
            reconcilerClock,
            new LoggingRiskEventListener(),
            correlationAdjuster,
            properties.getEventCapacity(),
            properties.getHistoryCapacity());
    log.info(
        "Risk ledger initialized initialBalance={} paperTrading={}",
        properties.getInitialBalance(),
        properties.getParameters().isPaperTrading());
    return ledger;
  }

  @Bean
  @ConditionalOnMissingBean
  public VenueRegistry venueRegistry(
      VenueProperties properties,
      Clock reconcilerClock,
      ObjectProvider<VenueAdapter> venueAdapters) {
    VenueRegistry registry = new VenueRegistry();
    for (VenueProperties.Paper paper : properties.getPaper()) {
      registry.register(new PaperVenueAdapter(paper.getName(), reconcilerClock));
    }
    venueAdapters.orderedStream().forEach(registry::register);
    List<String> names = registry.names();
    if (names.isEmpty()) {
      log.warn("No venues configured; reconciliation cycles will be empty");
    } else {
      log.info("Venues registered venues={}", names);
    }
    return registry;
  }

  @Bean(destroyMethod = "shutdownNow")
  @ConditionalOnMissingBean(name = "venueFetchExecutor")
  public ExecutorService venueFetchExecutor() {
    AtomicInteger sequence = new AtomicInteger();
    return Executors.newCachedThreadPool(
        new ThreadFactory() {
          @Override
          public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "venue-fetch-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
          }
        });
  }
}
