package com.riskrecon.integration.venue;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory venue used for paper trading. State is seeded by the caller; every read returns the
 * current seeded view.
 */
public class PaperVenueAdapter implements VenueAdapter {
  private static final Logger log = LoggerFactory.getLogger(PaperVenueAdapter.class);

  private final String name;
  private final Clock clock;
  private final ConcurrentMap<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, VenueOrderSnapshot> orders = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, VenuePositionSnapshot> positions = new ConcurrentHashMap<>();
  private volatile double pingMillis;

  public PaperVenueAdapter(String name) {
    this(name, Clock.systemUTC());
  }

  public PaperVenueAdapter(String name, Clock clock) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    this.name = name;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
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
    BigDecimal last = lastPrices.get(symbol);
    if (last == null) {
      throw new VenueConnectorException(name, "No paper price for symbol " + symbol, 404);
    }
    return new VenueTicker(symbol, last, last, last, clock.instant());
  }

  @Override
  public List<VenueOrderSnapshot> fetchOpenOrders() {
    return List.copyOf(new ArrayList<>(orders.values()));
  }

  @Override
  public List<VenuePositionSnapshot> fetchOpenPositions() {
    return List.copyOf(new ArrayList<>(positions.values()));
  }

  @Override
  public OptionalDouble pingTransport() {
    return OptionalDouble.of(pingMillis);
  }

  public void setLastPrice(String symbol, BigDecimal price) {
    Objects.requireNonNull(price, "price must not be null");
    lastPrices.put(symbol, price);
  }

  public void putOrder(VenueOrderSnapshot order) {
    Objects.requireNonNull(order, "order must not be null");
    orders.put(order.orderId(), order);
  }

  public void removeOrder(String orderId) {
    orders.remove(orderId);
  }

  public void putPosition(VenuePositionSnapshot position) {
    Objects.requireNonNull(position, "position must not be null");
    positions.put(position.symbol(), position);
    log.debug(
        "Paper position updated venue={} symbol={} side={} size={}",
        name,
        position.symbol(),
        position.side(),
        position.size());
  }

  public void closePosition(String symbol) {
    if (positions.remove(symbol) != null) {
      log.debug("Paper position closed venue={} symbol={}", name, symbol);
    }
  }

  public void setPingMillis(double pingMillis) {
    this.pingMillis = pingMillis;
  }
}
