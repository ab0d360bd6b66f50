package com.riskrecon.worker.reconcile;

import com.riskrecon.domain.risk.PositionSide;
import com.riskrecon.domain.risk.RiskLedger;
import com.riskrecon.integration.venue.VenueAdapter;
import com.riskrecon.integration.venue.VenueCapability;
import com.riskrecon.integration.venue.VenueConnectorException;
import com.riskrecon.integration.venue.VenueOrderSnapshot;
import com.riskrecon.integration.venue.VenuePositionSnapshot;
import com.riskrecon.integration.venue.VenueRegistry;
import com.riskrecon.integration.venue.VenueTicker;
import com.riskrecon.worker.breaker.BreakerSignal;
import com.riskrecon.worker.config.ReconcilerProperties;
import com.riskrecon.worker.health.HealthSnapshot;
import com.riskrecon.worker.health.TransportStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Reconciles the venue-scoped position cache against every registered venue and feeds the
 * differences into the {@link RiskLedger}.
 *
 * <p>One cycle fetches all venues in parallel, each bounded by the configured venue timeout, then
 * diffs and applies on the calling thread. A fetch that overruns is cancelled, and a venue is not
 * polled again until its previous fetch has returned. A venue that fails only loses its own contribution for
 * that cycle. The {@link HealthSnapshot} is published after every ledger call of the cycle has
 * returned.
 */
@Component
public class PositionReconciler {
  private static final Logger log = LoggerFactory.getLogger(PositionReconciler.class);

  private static final String CYCLE_TOTAL_METRIC = "worker.reconciler.cycle.total";
  private static final String CYCLE_DURATION_METRIC = "worker.reconciler.cycle.duration";
  private static final String FETCH_TOTAL_METRIC = "worker.reconciler.venue.fetch.total";
  private static final String FETCH_ERROR_METRIC = "worker.reconciler.venue.errors.total";
  private static final String POSITIONS_TRACKED_METRIC = "worker.reconciler.positions.tracked";
  private static final String FILLS_TOTAL_METRIC = "worker.reconciler.fills.total";
  private static final BigDecimal BPS = new BigDecimal("10000");

  private final VenueRegistry venueRegistry;
  private final RiskLedger riskLedger;
  private final BreakerSignal breakerSignal;
  private final ReconciliationReporter reporter;
  private final ReconcilerProperties properties;
  private final ExecutorService fetchExecutor;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private final Map<PositionKey, TrackedPosition> positions = new ConcurrentHashMap<>();
  private final Map<String, TransportStatus> transports = new ConcurrentHashMap<>();
  private final Map<String, VenueCall> inFlight = new ConcurrentHashMap<>();
  private final SlippageTracker slippageTracker = new SlippageTracker();
  private final LatencyWindow latencyWindow;
  private final AtomicReference<HealthSnapshot> snapshot;
  private final AtomicBoolean cycleInProgress = new AtomicBoolean(false);
  private final AtomicLong cycleCounter = new AtomicLong();
  private long ordersSeenTotal;
  private long fillsTotal;
  private volatile String lastError;

  @Autowired
  public PositionReconciler(
      VenueRegistry venueRegistry,
      RiskLedger riskLedger,
      BreakerSignal breakerSignal,
      ReconciliationReporter reporter,
      ReconcilerProperties properties,
      @Qualifier("venueFetchExecutor") ExecutorService fetchExecutor,
      MeterRegistry meterRegistry) {
    this(
        venueRegistry,
        riskLedger,
        breakerSignal,
        reporter,
        properties,
        fetchExecutor,
        meterRegistry,
        Clock.systemUTC());
  }

  PositionReconciler(
      VenueRegistry venueRegistry,
      RiskLedger riskLedger,
      BreakerSignal breakerSignal,
      ReconciliationReporter reporter,
      ReconcilerProperties properties,
      ExecutorService fetchExecutor,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.venueRegistry = venueRegistry;
    this.riskLedger = riskLedger;
    this.breakerSignal = breakerSignal;
    this.reporter = reporter;
    this.properties = properties;
    this.fetchExecutor = fetchExecutor;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.latencyWindow = new LatencyWindow(Math.max(1, properties.getLatencyWindow()));
    this.snapshot = new AtomicReference<>(HealthSnapshot.initial(clock.instant()));
    meterRegistry.gaugeMapSize(POSITIONS_TRACKED_METRIC, Tags.empty(), positions);
  }

  public HealthSnapshot currentSnapshot() {
    return snapshot.get();
  }

  public List<TrackedPosition> trackedPositions() {
    return positions.values().stream()
        .sorted(
            Comparator.comparing(TrackedPosition::venue).thenComparing(TrackedPosition::symbol))
        .toList();
  }

  public CycleOutcome runCycle() {
    if (!cycleInProgress.compareAndSet(false, true)) {
      log.info("Skipping reconciliation cycle because another cycle is in progress");
      incrementCycleTotal(CycleOutcome.SKIPPED);
      return CycleOutcome.SKIPPED;
    }
    long cycle = cycleCounter.incrementAndGet();
    Instant startedAt = clock.instant();
    try {
      if (breakerSignal.isEngaged()) {
        snapshot.set(snapshot.get().withBreaker(true, cycle, clock.instant()));
        complete(new CycleStats(), cycle, CycleOutcome.BREAKER_OPEN, startedAt);
        return CycleOutcome.BREAKER_OPEN;
      }

      List<VenueFetchResult> results = fetchAll();
      CycleStats stats = new CycleStats();
      List<Double> slippageSamples = new ArrayList<>();
      Instant now = clock.instant();
      for (VenueFetchResult result : results) {
        stats.venuesPolled++;
        if (!result.succeeded()) {
          recordVenueFailure(result.venue(), result.failure(), stats);
          continue;
        }
        incrementFetchTotal(result.venue(), "success");
        transports.put(result.venue(), result.transport());
        if (result.transportError() != null) {
          lastError = result.transportError();
        }
        latencyWindow.record(result.latencyMillis());
        detectFills(result, slippageSamples, stats);
        applyPositions(result, stats, now);
      }
      slippageTracker.recordBatch(slippageSamples);
      publish(cycle);
      complete(stats, cycle, CycleOutcome.COMPLETED, startedAt);
      return CycleOutcome.COMPLETED;
    } catch (RuntimeException ex) {
      lastError = sanitizeMessage("cycle " + cycle + ": " + messageOf(ex));
      incrementCycleTotal(CycleOutcome.FAILED);
      recordCycleDuration(startedAt);
      reporter.cycleFailed(cycle, ex);
      return CycleOutcome.FAILED;
    } finally {
      cycleInProgress.set(false);
    }
  }

  private List<VenueFetchResult> fetchAll() {
    long timeoutMillis = Math.max(1L, properties.getVenueTimeout().toMillis());
    long deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
    Map<String, VenueFetchResult> results = new LinkedHashMap<>();
    Map<String, VenueCall> dispatched = new LinkedHashMap<>();
    for (VenueAdapter venue : venueRegistry.all()) {
      results.put(venue.name(), null);
      VenueCall previous = inFlight.get(venue.name());
      if (previous != null && previous.busy()) {
        results.put(
            venue.name(),
            VenueFetchResult.failure(
                venue.name(),
                new VenueConnectorException(
                    venue.name(), "previous fetch still running", null, "TIMEOUT", null)));
        continue;
      }
      try {
        VenueCall call = dispatch(venue);
        inFlight.put(venue.name(), call);
        dispatched.put(venue.name(), call);
      } catch (RejectedExecutionException ex) {
        results.put(
            venue.name(),
            VenueFetchResult.failure(
                venue.name(),
                new VenueConnectorException(
                    venue.name(), "fetch rejected by executor", null, "REJECTED", ex)));
      }
    }
    for (Map.Entry<String, VenueCall> entry : dispatched.entrySet()) {
      results.put(
          entry.getKey(), await(entry.getKey(), entry.getValue(), deadlineNanos, timeoutMillis));
    }
    return new ArrayList<>(results.values());
  }

  private VenueCall dispatch(VenueAdapter venue) {
    VenueCall call = new VenueCall();
    call.future =
        fetchExecutor.submit(
            () -> {
              call.started = true;
              try {
                return fetchVenue(venue);
              } finally {
                call.finished = true;
              }
            });
    return call;
  }

  private VenueFetchResult await(
      String venue, VenueCall call, long deadlineNanos, long timeoutMillis) {
    long remainingNanos = Math.max(0L, deadlineNanos - System.nanoTime());
    try {
      return call.future.get(remainingNanos, TimeUnit.NANOSECONDS);
    } catch (TimeoutException | CancellationException ex) {
      call.future.cancel(true);
      return VenueFetchResult.failure(venue, VenueConnectorException.timeout(venue, timeoutMillis));
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      return VenueFetchResult.failure(venue, asVenueFailure(venue, cause));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      call.future.cancel(true);
      return VenueFetchResult.failure(
          venue,
          new VenueConnectorException(
              venue, "interrupted while fetching", null, "INTERRUPTED", ex));
    }
  }

  private VenueFetchResult fetchVenue(VenueAdapter venue) {
    long startedNanos = System.nanoTime();
    List<VenuePositionSnapshot> remotePositions =
        venue.supports(VenueCapability.OPEN_POSITIONS) ? venue.fetchOpenPositions() : List.of();
    List<VenueOrderSnapshot> orders = venue.fetchOpenOrders();
    double latencyMillis = (System.nanoTime() - startedNanos) / 1_000_000.0;
    Map<String, BigDecimal> markPrices = resolveMarkPrices(venue, remotePositions);

    if (!venue.supports(VenueCapability.TRANSPORT_PING)) {
      return VenueFetchResult.success(
          venue.name(),
          remotePositions,
          orders,
          markPrices,
          TransportStatus.unknown(),
          null,
          latencyMillis);
    }
    try {
      OptionalDouble ping = venue.pingTransport();
      TransportStatus transport =
          ping.isPresent() ? TransportStatus.up(ping.getAsDouble()) : TransportStatus.unknown();
      return VenueFetchResult.success(
          venue.name(), remotePositions, orders, markPrices, transport, null, latencyMillis);
    } catch (RuntimeException ex) {
      log.debug("Transport ping failed venue={}", venue.name(), ex);
      return VenueFetchResult.success(
          venue.name(),
          remotePositions,
          orders,
          markPrices,
          TransportStatus.down(),
          sanitizeMessage(venue.name() + ": transport ping failed: " + messageOf(ex)),
          latencyMillis);
    }
  }

  private Map<String, BigDecimal> resolveMarkPrices(
      VenueAdapter venue, List<VenuePositionSnapshot> remotePositions) {
    Map<String, BigDecimal> markPrices = new LinkedHashMap<>();
    if (remotePositions == null) {
      return markPrices;
    }
    for (VenuePositionSnapshot position : remotePositions) {
      if (!isOpen(position) || markPrices.containsKey(position.symbol())) {
        continue;
      }
      try {
        VenueTicker ticker = venue.fetchTicker(position.symbol());
        if (ticker != null && ticker.last() != null && ticker.last().signum() > 0) {
          markPrices.put(position.symbol(), ticker.last());
        }
      } catch (RuntimeException ex) {
        log.debug(
            "Ticker lookup failed, using average price venue={} symbol={}",
            venue.name(),
            position.symbol(),
            ex);
      }
    }
    return markPrices;
  }

  private void detectFills(
      VenueFetchResult result, List<Double> slippageSamples, CycleStats stats) {
    for (VenueOrderSnapshot order : result.orders()) {
      if (order == null) {
        continue;
      }
      stats.ordersSeen++;
      ordersSeenTotal++;
      if (!FillDetector.isFilled(order)) {
        continue;
      }
      stats.fills++;
      fillsTotal++;
      meterRegistry.counter(FILLS_TOTAL_METRIC, "venue", result.venue()).increment();
      BigDecimal fillPrice = order.fillPrice();
      BigDecimal referencePrice = order.resolvedReferencePrice();
      if (fillPrice != null && referencePrice != null && referencePrice.signum() > 0) {
        slippageSamples.add(
            fillPrice
                .subtract(referencePrice)
                .abs()
                .multiply(BPS)
                .divide(referencePrice, MathContext.DECIMAL64)
                .doubleValue());
      }
    }
  }

  private void applyPositions(VenueFetchResult result, CycleStats stats, Instant now) {
    String venue = result.venue();
    Map<String, VenuePositionSnapshot> remote = new LinkedHashMap<>();
    for (VenuePositionSnapshot position : result.positions()) {
      if (isOpen(position)) {
        remote.put(position.symbol(), position);
      }
    }

    for (VenuePositionSnapshot position : remote.values()) {
      PositionKey key = new PositionKey(venue, position.symbol());
      try {
        upsert(key, position, result.markPrices(), stats, now);
      } catch (RuntimeException ex) {
        stats.ledgerFailures++;
        lastError = sanitizeMessage(venue + ": " + position.symbol() + ": " + messageOf(ex));
        reporter.ledgerCallFailed("add_position", key, ex);
      }
    }

    List<PositionKey> closed =
        positions.keySet().stream()
            .filter(key -> key.venue().equals(venue) && !remote.containsKey(key.symbol()))
            .toList();
    for (PositionKey key : closed) {
      TrackedPosition removed = positions.remove(key);
      if (removed == null) {
        continue;
      }
      stats.closed++;
      try {
        riskLedger.removePosition(key.symbol(), removed.markPrice());
      } catch (RuntimeException ex) {
        stats.ledgerFailures++;
        lastError = sanitizeMessage(venue + ": " + key.symbol() + ": " + messageOf(ex));
        reporter.ledgerCallFailed("remove_position", key, ex);
      }
    }
  }

  private void upsert(
      PositionKey key,
      VenuePositionSnapshot position,
      Map<String, BigDecimal> markPrices,
      CycleStats stats,
      Instant now) {
    BigDecimal averagePrice = position.averagePrice();
    if (averagePrice == null) {
      throw new VenueConnectorException(
          key.venue(), "Missing average price for symbol " + key.symbol(), null);
    }
    PositionSide side = PositionSide.fromVenueSide(position.side());
    BigDecimal markPrice = markPrices.getOrDefault(key.symbol(), averagePrice);
    BigDecimal unrealizedPnl =
        markPrice.subtract(averagePrice).multiply(position.size()).multiply(side.direction());

    TrackedPosition existing = positions.get(key);
    if (existing == null) {
      riskLedger.addPosition(
          key.symbol(), side, position.size(), averagePrice, Map.of("venue", key.venue()));
      positions.put(
          key,
          new TrackedPosition(
              key.venue(),
              key.symbol(),
              side,
              position.size(),
              averagePrice,
              markPrice,
              unrealizedPnl,
              now));
      stats.opened++;
      return;
    }
    positions.put(
        key, existing.refresh(side, position.size(), averagePrice, markPrice, unrealizedPnl, now));
    stats.updated++;
  }

  private void publish(long cycle) {
    Map<String, TransportStatus> ordered = new LinkedHashMap<>();
    for (String name : venueRegistry.names()) {
      ordered.put(name, transports.getOrDefault(name, TransportStatus.unknown()));
    }
    double exposure = riskLedger.metrics().exposurePercentage();
    double fillRate = (double) fillsTotal / Math.max(1L, ordersSeenTotal);
    snapshot.set(
        new HealthSnapshot(
            false,
            ordered,
            exposure,
            slippageTracker.current(),
            latencyWindow.mean(),
            fillRate,
            lastError,
            cycle,
            clock.instant()));
  }

  private void recordVenueFailure(
      String venue, VenueConnectorException failure, CycleStats stats) {
    String errorCode = errorCode(failure);
    String message = sanitizeMessage(venue + ": " + messageOf(failure));
    stats.failedVenues.add(venue);
    transports.put(venue, TransportStatus.down());
    lastError = message;
    incrementFetchTotal(venue, "failure");
    meterRegistry.counter(FETCH_ERROR_METRIC, "venue", venue, "error", errorCode).increment();
    reporter.venueFailed(venue, errorCode, message, failure);
  }

  private void complete(CycleStats stats, long cycle, CycleOutcome outcome, Instant startedAt) {
    incrementCycleTotal(outcome);
    Duration duration = recordCycleDuration(startedAt);
    reporter.cycleCompleted(
        new CycleSummary(
            cycle,
            outcome,
            stats.venuesPolled,
            stats.failedVenues,
            stats.opened,
            stats.updated,
            stats.closed,
            stats.ordersSeen,
            stats.fills,
            stats.ledgerFailures,
            duration));
  }

  private void incrementCycleTotal(CycleOutcome outcome) {
    meterRegistry.counter(CYCLE_TOTAL_METRIC, "outcome", outcome.metricTag()).increment();
  }

  private void incrementFetchTotal(String venue, String outcome) {
    meterRegistry.counter(FETCH_TOTAL_METRIC, "venue", venue, "outcome", outcome).increment();
  }

  private Duration recordCycleDuration(Instant startedAt) {
    Duration duration = Duration.between(startedAt, clock.instant()).abs();
    Timer.builder(CYCLE_DURATION_METRIC)
        .description("Reconciliation cycle latency")
        .register(meterRegistry)
        .record(duration);
    return duration;
  }

  private static boolean isOpen(VenuePositionSnapshot position) {
    return position != null
        && position.symbol() != null
        && position.size() != null
        && position.size().signum() > 0;
  }

  private static VenueConnectorException asVenueFailure(String venue, Throwable error) {
    if (error instanceof VenueConnectorException ex) {
      return ex;
    }
    return new VenueConnectorException(venue, messageOf(error), null, errorCode(error), error);
  }

  private static String errorCode(Throwable error) {
    if (error instanceof VenueConnectorException ex && ex.errorCode() != null) {
      return ex.errorCode();
    }
    String simpleName = error.getClass().getSimpleName();
    return simpleName == null || simpleName.isBlank() ? "UnknownError" : simpleName;
  }

  private static String messageOf(Throwable error) {
    String message = error.getMessage();
    return message == null || message.isBlank() ? errorCode(error) : message;
  }

  private String sanitizeMessage(String message) {
    String compact = message.replaceAll("\\s+", " ").trim();
    int maxLength = Math.max(1, properties.getErrorMessageMaxLength());
    if (compact.length() <= maxLength) {
      return compact;
    }
    return compact.substring(0, maxLength);
  }

  /**
   * One dispatched venue fetch. A cancelled call whose thread ignores the interrupt still counts
   * as busy until the adapter returns, so a hung venue holds at most one fetch thread.
   */
  private static final class VenueCall {
    private volatile Future<VenueFetchResult> future;
    private volatile boolean started;
    private volatile boolean finished;

    private boolean busy() {
      Future<VenueFetchResult> current = future;
      return (current != null && !current.isDone()) || (started && !finished);
    }
  }

  private static final class CycleStats {
    private int venuesPolled;
    private final List<String> failedVenues = new ArrayList<>();
    private int opened;
    private int updated;
    private int closed;
    private int ordersSeen;
    private int fills;
    private int ledgerFailures;
  }
}
