package com.riskrecon.worker.reconcile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.riskrecon.domain.risk.PositionSide;
import com.riskrecon.domain.risk.RiskDomainException;
import com.riskrecon.domain.risk.RiskLedger;
import com.riskrecon.domain.risk.RiskMetrics;
import com.riskrecon.integration.venue.PaperVenueAdapter;
import com.riskrecon.integration.venue.VenueAdapter;
import com.riskrecon.integration.venue.VenueCapability;
import com.riskrecon.integration.venue.VenueConnectorException;
import com.riskrecon.integration.venue.VenueOrderSnapshot;
import com.riskrecon.integration.venue.VenuePositionSnapshot;
import com.riskrecon.integration.venue.VenueRegistry;
import com.riskrecon.integration.venue.VenueTicker;
import com.riskrecon.worker.config.ReconcilerConfiguration;
import com.riskrecon.worker.config.ReconcilerProperties;
import com.riskrecon.worker.health.HealthSnapshot;
import com.riskrecon.worker.health.TransportState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PositionReconcilerTest {
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-03-02T12:00:00Z"), ZoneOffset.UTC);

  private RiskLedger riskLedger;
  private ReconciliationReporter reporter;
  private ExecutorService executor;
  private SimpleMeterRegistry meterRegistry;
  private ReconcilerProperties properties;
  private AtomicBoolean breakerEngaged;

  @BeforeEach
  void setUp() {
    riskLedger = mock(RiskLedger.class);
    reporter = mock(ReconciliationReporter.class);
    when(riskLedger.metrics()).thenReturn(metricsWithExposureRatio("0"));
    executor = Executors.newCachedThreadPool();
    meterRegistry = new SimpleMeterRegistry();
    properties = new ReconcilerProperties();
    properties.setVenueTimeout(Duration.ofSeconds(2));
    breakerEngaged = new AtomicBoolean(false);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void shouldRegisterNewRemotePositionExactlyOnce() {
    PaperVenueAdapter venue = new PaperVenueAdapter("paper-a", CLOCK);
    venue.setLastPrice("BTCUSDT", new BigDecimal("42000"));
    venue.putPosition(position("BTCUSDT", "long", "0.5", "40000"));
    PositionReconciler reconciler = reconciler(venue);

    assertEquals(CycleOutcome.COMPLETED, reconciler.runCycle());
    assertEquals(CycleOutcome.COMPLETED, reconciler.runCycle());

    verify(riskLedger, times(1))
        .addPosition(
            "BTCUSDT",
            PositionSide.LONG,
            new BigDecimal("0.5"),
            new BigDecimal("40000"),
            Map.of("venue", "paper-a"));
    List<TrackedPosition> tracked = reconciler.trackedPositions();
    assertEquals(1, tracked.size());
    assertEquals(0, new BigDecimal("42000").compareTo(tracked.get(0).markPrice()));
    assertEquals(0, new BigDecimal("1000").compareTo(tracked.get(0).unrealizedPnl()));
    assertEquals(
        1.0, meterRegistry.get("worker.reconciler.positions.tracked").gauge().value());
  }

  @Test
  void shouldCloseMissingPositionAndRemoveFromLedgerOnce() {
    PaperVenueAdapter venue = new PaperVenueAdapter("paper-a", CLOCK);
    venue.setLastPrice("ETHUSDT", new BigDecimal("2100"));
    venue.putPosition(position("ETHUSDT", "short", "2", "2000"));
    PositionReconciler reconciler = reconciler(venue);
    reconciler.runCycle();
    assertEquals(
        0, new BigDecimal("-200").compareTo(reconciler.trackedPositions().get(0).unrealizedPnl()));

    venue.closePosition("ETHUSDT");
    reconciler.runCycle();
    reconciler.runCycle();

    verify(riskLedger, times(1)).removePosition("ETHUSDT", new BigDecimal("2100"));
    assertTrue(reconciler.trackedPositions().isEmpty());
  }

  @Test
  void shouldKeepOneEntryPerVenueAndSymbol() {
    StaticVenue first = new StaticVenue("venue-a", EnumSet.of(VenueCapability.OPEN_POSITIONS));
    first.positions =
        List.of(
            position("BTCUSDT", "buy", "1", "100"),
            position("BTCUSDT", "buy", "2", "101"),
            position("SOLUSDT", "buy", "0", "20"));
    StaticVenue second = new StaticVenue("venue-b", EnumSet.of(VenueCapability.OPEN_POSITIONS));
    second.positions = List.of(position("BTCUSDT", "sell", "3", "99"));
    PositionReconciler reconciler = reconciler(first, second);

    reconciler.runCycle();
    reconciler.runCycle();

    List<TrackedPosition> tracked = reconciler.trackedPositions();
    assertEquals(2, tracked.size());
    assertEquals(new PositionKey("venue-a", "BTCUSDT"), tracked.get(0).key());
    assertEquals(new BigDecimal("2"), tracked.get(0).size());
    assertEquals(new PositionKey("venue-b", "BTCUSDT"), tracked.get(1).key());
    assertEquals(PositionSide.SHORT, tracked.get(1).side());
    verify(riskLedger, never()).addPosition(eq("SOLUSDT"), any(), any(), any(), anyMap());
  }

  @Test
  void shouldSmoothSlippageAcrossBatches() {
    StaticVenue venue = new StaticVenue("venue-a", EnumSet.noneOf(VenueCapability.class));
    venue.orders = List.of(order("o-1", "closed", "1", "1", "100", "100.1"));
    PositionReconciler reconciler = reconciler(venue);

    reconciler.runCycle();
    assertEquals(10.0, reconciler.currentSnapshot().slippageBps(), 1e-9);

    venue.orders = List.of(order("o-2", "closed", "1", "1", "100", "100.2"));
    reconciler.runCycle();

    assertEquals(12.0, reconciler.currentSnapshot().slippageBps(), 1e-9);
  }

  @Test
  void shouldComputeFillRateFromThresholdAndStatus() {
    StaticVenue venue = new StaticVenue("venue-a", EnumSet.noneOf(VenueCapability.class));
    List<VenueOrderSnapshot> orders = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      orders.add(order("closed-" + i, "closed", "1", "1", "100", null));
    }
    for (int i = 0; i < 3; i++) {
      orders.add(order("nearly-" + i, "open", "1", "0.995", "100", null));
    }
    for (int i = 0; i < 4; i++) {
      orders.add(order("open-" + i, "open", "1", "0.5", "100", null));
    }
    venue.orders = orders;
    PositionReconciler reconciler = reconciler(venue);

    reconciler.runCycle();

    assertEquals(0.6, reconciler.currentSnapshot().fillRate(), 1e-9);
    assertEquals(
        6.0, meterRegistry.counter("worker.reconciler.fills.total", "venue", "venue-a").count());
  }

  @Test
  void shouldReconcileHealthyVenueWhenAnotherFails() {
    PaperVenueAdapter healthy = new PaperVenueAdapter("paper-a", CLOCK);
    healthy.setLastPrice("BTCUSDT", new BigDecimal("100"));
    healthy.putPosition(position("BTCUSDT", "long", "1", "100"));
    healthy.setPingMillis(8.0);
    FailingVenue broken = new FailingVenue("broken");
    PositionReconciler reconciler = reconciler(healthy, broken);

    assertEquals(CycleOutcome.COMPLETED, reconciler.runCycle());

    HealthSnapshot snapshot = reconciler.currentSnapshot();
    assertEquals(TransportState.UP, snapshot.transports().get("paper-a").state());
    assertEquals(8.0, snapshot.transports().get("paper-a").pingMillis(), 1e-9);
    assertEquals(TransportState.DOWN, snapshot.transports().get("broken").state());
    assertEquals("broken: connection refused by upstream", snapshot.lastError());
    assertEquals(List.of("paper-a", "broken"), List.copyOf(snapshot.transports().keySet()));
    verify(riskLedger)
        .addPosition(
            "BTCUSDT",
            PositionSide.LONG,
            new BigDecimal("1"),
            new BigDecimal("100"),
            Map.of("venue", "paper-a"));
    verify(reporter)
        .venueFailed(
            eq("broken"),
            eq("HTTP_503"),
            eq("broken: connection refused by upstream"),
            any(VenueConnectorException.class));
    assertEquals(
        1.0,
        meterRegistry
            .counter(
                "worker.reconciler.venue.errors.total", "venue", "broken", "error", "HTTP_503")
            .count());
  }

  @Test
  void shouldKeepCachedPositionsOfFailedVenue() {
    StaticVenue venue = new StaticVenue("venue-a", EnumSet.of(VenueCapability.OPEN_POSITIONS));
    venue.positions = List.of(position("BTCUSDT", "long", "1", "100"));
    PositionReconciler reconciler = reconciler(venue);
    reconciler.runCycle();

    venue.failure = new VenueConnectorException("venue-a", "gateway timeout", 504);
    reconciler.runCycle();

    assertEquals(1, reconciler.trackedPositions().size());
    verify(riskLedger, never()).removePosition(any(), any());
    assertEquals(
        TransportState.DOWN, reconciler.currentSnapshot().transports().get("venue-a").state());
  }

  @Test
  void shouldTreatSlowVenueAsTimeout() {
    properties.setVenueTimeout(Duration.ofMillis(100));
    CountDownLatch release = new CountDownLatch(1);
    StaticVenue slow = new StaticVenue("slow", EnumSet.noneOf(VenueCapability.class));
    slow.gate = release;
    PositionReconciler reconciler = reconciler(slow);

    try {
      assertEquals(CycleOutcome.COMPLETED, reconciler.runCycle());
    } finally {
      release.countDown();
    }

    HealthSnapshot snapshot = reconciler.currentSnapshot();
    assertEquals(TransportState.DOWN, snapshot.transports().get("slow").state());
    assertEquals("slow: timed out after 100ms", snapshot.lastError());
    assertEquals(
        1.0,
        meterRegistry
            .counter("worker.reconciler.venue.errors.total", "venue", "slow", "error", "TIMEOUT")
            .count());
  }

  @Test
  void shouldOnlyFlipBreakerFlagWhenEngaged() {
    StaticVenue venue = new StaticVenue("venue-a", EnumSet.of(VenueCapability.OPEN_POSITIONS));
    venue.positions = List.of(position("BTCUSDT", "long", "1", "100"));
    PositionReconciler reconciler = reconciler(venue);
    breakerEngaged.set(true);

    assertEquals(CycleOutcome.BREAKER_OPEN, reconciler.runCycle());

    assertTrue(reconciler.currentSnapshot().breakerOpen());
    assertEquals(0, venue.fetches.get());
    verifyNoInteractions(riskLedger);
    assertTrue(reconciler.trackedPositions().isEmpty());

    breakerEngaged.set(false);
    assertEquals(CycleOutcome.COMPLETED, reconciler.runCycle());
    assertFalse(reconciler.currentSnapshot().breakerOpen());
    assertEquals(1, reconciler.trackedPositions().size());
    assertEquals(
        1.0,
        meterRegistry.counter("worker.reconciler.cycle.total", "outcome", "breaker_open").count());
  }

  @Test
  void shouldReportUnknownTransportWithoutPingCapability() {
    StaticVenue venue = new StaticVenue("venue-a", EnumSet.of(VenueCapability.OPEN_POSITIONS));
    PositionReconciler reconciler = reconciler(venue);

    reconciler.runCycle();

    HealthSnapshot snapshot = reconciler.currentSnapshot();
    assertEquals(TransportState.UNKNOWN, snapshot.transports().get("venue-a").state());
    assertNull(snapshot.transports().get("venue-a").pingMillis());
    assertNull(snapshot.lastError());
  }

  @Test
  void shouldFallBackToAveragePriceWhenTickerFails() {
    PaperVenueAdapter venue = new PaperVenueAdapter("paper-a", CLOCK);
    venue.putPosition(position("XRPUSDT", "long", "10", "0.5"));
    PositionReconciler reconciler = reconciler(venue);

    reconciler.runCycle();

    TrackedPosition tracked = reconciler.trackedPositions().get(0);
    assertEquals(new BigDecimal("0.5"), tracked.markPrice());
    assertEquals(0, BigDecimal.ZERO.compareTo(tracked.unrealizedPnl()));
  }

  @Test
  void shouldPublishExposureFromLedgerMetrics() {
    when(riskLedger.metrics()).thenReturn(metricsWithExposureRatio("0.25"));
    PositionReconciler reconciler = reconciler(new PaperVenueAdapter("paper-a", CLOCK));

    reconciler.runCycle();

    assertEquals(25.0, reconciler.currentSnapshot().exposurePercentage(), 1e-9);
    assertEquals(1L, reconciler.currentSnapshot().cycle());
    assertEquals(CLOCK.instant(), reconciler.currentSnapshot().updatedAt());
  }

  @Test
  void shouldContinueWhenLedgerRejectsOnePosition() {
    StaticVenue venue = new StaticVenue("venue-a", EnumSet.of(VenueCapability.OPEN_POSITIONS));
    venue.positions =
        List.of(position("BADUSDT", "long", "1", "0"), position("BTCUSDT", "long", "1", "100"));
    doThrow(new RiskDomainException("entryPrice must be > 0"))
        .when(riskLedger)
        .addPosition(eq("BADUSDT"), any(), any(), any(), anyMap());
    PositionReconciler reconciler = reconciler(venue);

    assertEquals(CycleOutcome.COMPLETED, reconciler.runCycle());

    List<TrackedPosition> tracked = reconciler.trackedPositions();
    assertEquals(1, tracked.size());
    assertEquals("BTCUSDT", tracked.get(0).symbol());
    assertEquals(
        "venue-a: BADUSDT: entryPrice must be > 0", reconciler.currentSnapshot().lastError());
    verify(reporter)
        .ledgerCallFailed(
            eq("add_position"),
            eq(new PositionKey("venue-a", "BADUSDT")),
            any(RiskDomainException.class));
  }

  @Test
  void shouldTruncateLongErrorMessages() {
    properties.setErrorMessageMaxLength(20);
    FailingVenue broken = new FailingVenue("broken");
    PositionReconciler reconciler = reconciler(broken);

    reconciler.runCycle();

    String lastError = reconciler.currentSnapshot().lastError();
    assertNotNull(lastError);
    assertEquals(20, lastError.length());
    assertTrue(lastError.startsWith("broken: "));
  }

  private PositionReconciler reconciler(VenueAdapter... venues) {
    return new PositionReconciler(
        new VenueRegistry(List.of(venues)),
        riskLedger,
        breakerEngaged::get,
        reporter,
        properties,
        executor,
        meterRegistry,
        CLOCK);
  }

  private static VenuePositionSnapshot position(
      String symbol, String side, String size, String averagePrice) {
    return new VenuePositionSnapshot(
        symbol, side, new BigDecimal(size), new BigDecimal(averagePrice));
  }

  @Test
  void shouldHoldAtMostOneThreadForHungVenue() throws Exception {
    properties.setVenueTimeout(Duration.ofMillis(20));
    ThreadPoolExecutor fetchPool =
        (ThreadPoolExecutor) new ReconcilerConfiguration().venueFetchExecutor();
    HungVenue hung = new HungVenue("hung");
    PositionReconciler reconciler =
        new PositionReconciler(
            new VenueRegistry(List.of(hung)),
            riskLedger,
            breakerEngaged::get,
            reporter,
            properties,
            fetchPool,
            meterRegistry,
            CLOCK);

    try {
      for (int i = 0; i < 25; i++) {
        assertEquals(CycleOutcome.COMPLETED, reconciler.runCycle());
      }

      assertEquals(1, hung.calls.get());
      assertEquals(1, fetchPool.getLargestPoolSize());
      assertTrue(fetchPool.getActiveCount() <= 1);
      assertEquals(
          TransportState.DOWN, reconciler.currentSnapshot().transports().get("hung").state());
      assertEquals(
          25.0,
          meterRegistry
              .counter("worker.reconciler.venue.errors.total", "venue", "hung", "error", "TIMEOUT")
              .count());

      hung.release.countDown();
      long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
      while (reconciler.currentSnapshot().transports().get("hung").state() == TransportState.DOWN
          && System.nanoTime() < deadline) {
        reconciler.runCycle();
        Thread.sleep(10);
      }
      assertEquals(
          TransportState.UNKNOWN, reconciler.currentSnapshot().transports().get("hung").state());
      assertEquals(2, hung.calls.get());
    } finally {
      hung.release.countDown();
      fetchPool.shutdownNow();
    }
  }

  private static VenueOrderSnapshot order(
      String id, String status, String amount, String filled, String price, String average) {
    return new VenueOrderSnapshot(
        id,
        "BTCUSDT",
        "buy",
        new BigDecimal(amount),
        new BigDecimal(filled),
        status,
        new BigDecimal(price),
        average == null ? null : new BigDecimal(average),
        null);
  }

  private static RiskMetrics metricsWithExposureRatio(String exposureRatio) {
    return new RiskMetrics(
        new BigDecimal("10000"),
        new BigDecimal("10000"),
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        0,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        new BigDecimal(exposureRatio),
        false,
        CLOCK.instant());
  }

  private static final class StaticVenue implements VenueAdapter {
    private final String name;
    private final Set<VenueCapability> capabilities;
    private final AtomicInteger fetches = new AtomicInteger();
    private volatile List<VenuePositionSnapshot> positions = List.of();
    private volatile List<VenueOrderSnapshot> orders = List.of();
    private volatile VenueConnectorException failure;
    private volatile CountDownLatch gate;

    private StaticVenue(String name, Set<VenueCapability> capabilities) {
      this.name = name;
      this.capabilities = capabilities;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public Set<VenueCapability> capabilities() {
      return capabilities;
    }

    @Override
    public VenueTicker fetchTicker(String symbol) {
      throw new VenueConnectorException(name, "no ticker for " + symbol, 404);
    }

    @Override
    public List<VenueOrderSnapshot> fetchOpenOrders() {
      fetches.incrementAndGet();
      CountDownLatch currentGate = gate;
      if (currentGate != null) {
        try {
          currentGate.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      }
      if (failure != null) {
        throw failure;
      }
      return orders;
    }

    @Override
    public List<VenuePositionSnapshot> fetchOpenPositions() {
      return positions;
    }
  }

  private static final class FailingVenue implements VenueAdapter {
    private final String name;

    private FailingVenue(String name) {
      this.name = name;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public Set<VenueCapability> capabilities() {
      return EnumSet.allOf(VenueCapability.class);
    }

    @Override
    public VenueTicker fetchTicker(String symbol) {
      throw new VenueConnectorException(name, "unreachable", 503);
    }

    @Override
    public List<VenueOrderSnapshot> fetchOpenOrders() {
      throw new VenueConnectorException(name, "connection   refused\n by upstream", 503);
    }

    @Override
    public List<VenuePositionSnapshot> fetchOpenPositions() {
      throw new VenueConnectorException(name, "connection   refused\n by upstream", 503);
    }
  }

  /** Blocks its first order fetch until released, ignoring interrupts. */
  private static final class HungVenue implements VenueAdapter {
    private final String name;
    private final AtomicInteger calls = new AtomicInteger();
    private final CountDownLatch release = new CountDownLatch(1);

    private HungVenue(String name) {
      this.name = name;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public Set<VenueCapability> capabilities() {
      return EnumSet.noneOf(VenueCapability.class);
    }

    @Override
    public VenueTicker fetchTicker(String symbol) {
      throw new VenueConnectorException(name, "no ticker for " + symbol, 404);
    }

    @Override
    public List<VenueOrderSnapshot> fetchOpenOrders() {
      if (calls.incrementAndGet() > 1) {
        return List.of();
      }
      boolean interrupted = false;
      while (release.getCount() > 0) {
        try {
          release.await();
        } catch (InterruptedException ex) {
          interrupted = true;
        }
      }
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
      return List.of();
    }
  }
}
