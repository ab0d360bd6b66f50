package com.riskrecon.domain.risk;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

public class InMemoryRiskLedger implements RiskLedger {
  public static final int DEFAULT_EVENT_CAPACITY = 1000;
  public static final int DEFAULT_HISTORY_CAPACITY = 1000;
  static final int REPORT_HISTORY_LIMIT = 50;
  static final int REPORT_EVENT_LIMIT = 100;

  static final String DAILY_LOSS_LIMIT_REASON = "Daily loss limit reached";
  static final String EMERGENCY_STOP_REASON = "Emergency stop loss triggered";
  static final String MAX_OPEN_POSITIONS_REASON = "Maximum open positions reached";
  static final String HIGH_VOLATILITY_REASON = "High volatility detected - proceed with caution";
  static final String LOW_LIQUIDITY_REASON = "Low liquidity detected";

  private static final MathContext MC = MathContext.DECIMAL64;
  private static final BigDecimal HUNDRED = new BigDecimal("100");
  private static final BigDecimal TWO = new BigDecimal("2");
  private static final BigDecimal HALF = new BigDecimal("0.5");
  private static final BigDecimal BALANCE_NOISE_FRACTION = new BigDecimal("0.001");

  private final ReentrantLock lock = new ReentrantLock();
  private final BigDecimal initialBalance;
  private final RiskParameters parameters;
  private final Clock clock;
  private final RiskEventListener eventListener;
  private final CorrelationAdjuster correlationAdjuster;
  private final Map<String, LedgerPosition> openPositions = new LinkedHashMap<>();
  private final BoundedHistory<PositionHistoryEntry> positionHistory;
  private final BoundedHistory<RiskEvent> events;

  private BigDecimal currentBalance;
  private BigDecimal dailyPnl = BigDecimal.ZERO;
  private Instant lastUpdate;

  public InMemoryRiskLedger(BigDecimal initialBalance, RiskParameters parameters) {
    this(
        initialBalance,
        parameters,
        Clock.systemUTC(),
        RiskEventListener.noop(),
        CorrelationAdjuster.none(),
        DEFAULT_EVENT_CAPACITY,
        DEFAULT_HISTORY_CAPACITY);
  }

  public InMemoryRiskLedger(
      BigDecimal initialBalance,
      RiskParameters parameters,
      Clock clock,
      RiskEventListener eventListener,
      CorrelationAdjuster correlationAdjuster,
      int eventCapacity,
      int historyCapacity) {
    Objects.requireNonNull(initialBalance, "initialBalance must not be null");
    if (initialBalance.signum() <= 0) {
      throw new RiskDomainException("initialBalance must be > 0");
    }
    this.initialBalance = initialBalance;
    this.currentBalance = initialBalance;
    this.parameters = Objects.requireNonNull(parameters, "parameters must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.eventListener = Objects.requireNonNull(eventListener, "eventListener must not be null");
    this.correlationAdjuster =
        Objects.requireNonNull(correlationAdjuster, "correlationAdjuster must not be null");
    this.events = new BoundedHistory<>(eventCapacity);
    this.positionHistory = new BoundedHistory<>(historyCapacity);
    this.lastUpdate = clock.instant();
  }

  @Override
  public BigDecimal sizePosition(
      String symbol, BigDecimal entryPrice, BigDecimal stopPrice, BigDecimal volatility) {
    requireSymbol(symbol);
    requirePositive(entryPrice, "entryPrice");
    Objects.requireNonNull(stopPrice, "stopPrice must not be null");
    requireNonNegativeIfPresent(volatility, "volatility");
    lock.lock();
    try {
      BigDecimal maxPositionValue = maxPositionValue();
      BigDecimal priceRisk = entryPrice.subtract(stopPrice).abs().divide(entryPrice, MC);
      if (priceRisk.signum() == 0) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("calculatedSize", BigDecimal.ZERO);
        attributes.put("reason", "zero_price_risk");
        appendEvent(RiskEventType.POSITION_SIZING, symbol, attributes);
        return BigDecimal.ZERO;
      }

      BigDecimal riskPerTrade = maxPositionValue;
      BigDecimal volatilityFactor = BigDecimal.ONE;
      if (volatility != null && parameters.volatilityAdjustment()) {
        volatilityFactor = BigDecimal.ONE.subtract(volatility.multiply(TWO)).max(HALF);
        riskPerTrade = riskPerTrade.multiply(volatilityFactor);
      }

      BigDecimal correlationAdjustment =
          correlationAdjuster.adjustmentFor(symbol, List.copyOf(openPositions.values()));
      if (correlationAdjustment == null || correlationAdjustment.signum() < 0) {
        throw new RiskDomainException(
            "Correlation adjustment must be >= 0 for symbol " + symbol);
      }
      riskPerTrade = riskPerTrade.multiply(correlationAdjustment);

      BigDecimal positionValue = riskPerTrade.divide(priceRisk, MC);
      BigDecimal size = positionValue.min(maxPositionValue).divide(entryPrice, MC);

      Map<String, Object> attributes = new LinkedHashMap<>();
      attributes.put("calculatedSize", size);
      attributes.put("volatilityFactor", volatilityFactor);
      attributes.put("correlationAdjustment", correlationAdjustment);
      appendEvent(RiskEventType.POSITION_SIZING, symbol, attributes);
      return size;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public TradeValidation validateTrade(
      String symbol,
      PositionSide side,
      BigDecimal quantity,
      BigDecimal price,
      MarketConditions marketConditions) {
    requireSymbol(symbol);
    Objects.requireNonNull(side, "side must not be null");
    requirePositive(quantity, "quantity");
    requirePositive(price, "price");
    MarketConditions conditions =
        marketConditions == null ? MarketConditions.normal() : marketConditions;
    lock.lock();
    try {
      boolean valid = true;
      List<String> reasons = new ArrayList<>();

      BigDecimal dailyLossLimit =
          currentBalance.multiply(parameters.maxDailyLossFraction()).negate();
      if (dailyPnl.compareTo(dailyLossLimit) <= 0) {
        valid = false;
        reasons.add(DAILY_LOSS_LIMIT_REASON);
      }

      BigDecimal totalLoss = initialBalance.subtract(currentBalance).divide(initialBalance, MC);
      if (totalLoss.compareTo(parameters.emergencyStopLossFraction()) >= 0) {
        valid = false;
        reasons.add(EMERGENCY_STOP_REASON);
      }

      if (openPositions.size() >= parameters.maxOpenPositions()) {
        valid = false;
        reasons.add(MAX_OPEN_POSITIONS_REASON);
      }

      BigDecimal positionValue = quantity.multiply(price);
      BigDecimal maxPositionValue = maxPositionValue();
      if (positionValue.compareTo(maxPositionValue) > 0) {
        valid = false;
        reasons.add(
            "Position size exceeds limit: "
                + money(positionValue)
                + " > "
                + money(maxPositionValue));
      }

      if (conditions.highVolatility()) {
        reasons.add(HIGH_VOLATILITY_REASON);
      }
      if (conditions.lowLiquidity()) {
        reasons.add(LOW_LIQUIDITY_REASON);
      }

      TradeValidation result = new TradeValidation(valid, reasons);
      Map<String, Object> attributes = new LinkedHashMap<>();
      attributes.put("side", side.name());
      attributes.put("quantity", quantity);
      attributes.put("price", price);
      attributes.put("valid", valid);
      attributes.put("reasons", result.reasons());
      appendEvent(RiskEventType.TRADE_VALIDATION, symbol, attributes);
      return result;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public StopTakeLevels stopTakeLevels(
      BigDecimal entryPrice, PositionSide side, BigDecimal volatility) {
    requirePositive(entryPrice, "entryPrice");
    Objects.requireNonNull(side, "side must not be null");
    requireNonNegativeIfPresent(volatility, "volatility");
    BigDecimal stopFraction = parameters.stopLossFraction();
    BigDecimal takeFraction = parameters.takeProfitFraction();
    if (volatility != null && parameters.volatilityAdjustment()) {
      BigDecimal widening = BigDecimal.ONE.add(volatility.multiply(HALF));
      stopFraction = stopFraction.multiply(widening);
      takeFraction = takeFraction.multiply(widening);
    }

    BigDecimal stopLoss;
    BigDecimal takeProfit;
    if (side == PositionSide.LONG) {
      stopLoss = entryPrice.multiply(BigDecimal.ONE.subtract(stopFraction));
      takeProfit = entryPrice.multiply(BigDecimal.ONE.add(takeFraction));
    } else {
      stopLoss = entryPrice.multiply(BigDecimal.ONE.add(stopFraction));
      takeProfit = entryPrice.multiply(BigDecimal.ONE.subtract(takeFraction));
    }
    BigDecimal riskReward = takeFraction.divide(stopFraction, MC);
    return new StopTakeLevels(
        stopLoss,
        takeProfit,
        riskReward,
        riskReward.compareTo(parameters.minRiskRewardRatio()) >= 0);
  }

  @Override
  public void updateBalance(BigDecimal newBalance) {
    Objects.requireNonNull(newBalance, "newBalance must not be null");
    if (newBalance.signum() < 0) {
      throw new RiskDomainException("newBalance must be >= 0");
    }
    lock.lock();
    try {
      BigDecimal pnlChange = newBalance.subtract(currentBalance);
      BigDecimal oldBalance = currentBalance;
      dailyPnl = dailyPnl.add(pnlChange);
      currentBalance = newBalance;
      lastUpdate = clock.instant();

      if (pnlChange.abs().compareTo(currentBalance.multiply(BALANCE_NOISE_FRACTION)) > 0) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("oldBalance", oldBalance);
        attributes.put("newBalance", newBalance);
        attributes.put("pnlChange", pnlChange);
        attributes.put("dailyPnl", dailyPnl);
        appendEvent(RiskEventType.BALANCE_UPDATE, null, attributes);
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void addPosition(
      String symbol,
      PositionSide side,
      BigDecimal quantity,
      BigDecimal entryPrice,
      Map<String, String> metadata) {
    requireSymbol(symbol);
    Objects.requireNonNull(side, "side must not be null");
    requirePositive(quantity, "quantity");
    requirePositive(entryPrice, "entryPrice");
    lock.lock();
    try {
      LedgerPosition position =
          new LedgerPosition(symbol, side, quantity, entryPrice, clock.instant(), metadata);
      openPositions.put(symbol, position);
      positionHistory.append(PositionHistoryEntry.opened(position));

      Map<String, Object> attributes = new LinkedHashMap<>();
      attributes.put("side", side.name());
      attributes.put("quantity", quantity);
      attributes.put("entryPrice", entryPrice);
      appendEvent(RiskEventType.POSITION_OPENED, symbol, attributes);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean removePosition(String symbol, BigDecimal exitPrice) {
    requireSymbol(symbol);
    lock.lock();
    try {
      LedgerPosition position = openPositions.remove(symbol);
      if (position == null) {
        return false;
      }
      Map<String, Object> attributes = new LinkedHashMap<>();
      attributes.put("side", position.side().name());
      attributes.put("quantity", position.quantity());
      if (exitPrice != null) {
        BigDecimal realizedPnl =
            exitPrice
                .subtract(position.entryPrice())
                .multiply(position.quantity())
                .multiply(position.side().direction());
        positionHistory.append(
            PositionHistoryEntry.closed(position, exitPrice, realizedPnl, clock.instant()));
        attributes.put("exitPrice", exitPrice);
        attributes.put("realizedPnl", realizedPnl);
      }
      appendEvent(RiskEventType.POSITION_CLOSED, symbol, attributes);
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public RiskMetrics metrics() {
    lock.lock();
    try {
      return computeMetrics();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public RiskReport exportReport() {
    lock.lock();
    try {
      return new RiskReport(
          parameters,
          computeMetrics(),
          positionHistory.latest(REPORT_HISTORY_LIMIT),
          events.latest(REPORT_EVENT_LIMIT),
          clock.instant());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void resetDaily() {
    lock.lock();
    try {
      BigDecimal previousDailyPnl = dailyPnl;
      dailyPnl = BigDecimal.ZERO;
      appendEvent(
          RiskEventType.DAILY_RESET, null, Map.of("previousDailyPnl", previousDailyPnl));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<LedgerPosition> openPositions() {
    lock.lock();
    try {
      return List.copyOf(openPositions.values());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<RiskEvent> recentEvents(int limit) {
    lock.lock();
    try {
      return events.latest(limit);
    } finally {
      lock.unlock();
    }
  }

  public RiskParameters parameters() {
    return parameters;
  }

  private RiskMetrics computeMetrics() {
    BigDecimal totalExposure = BigDecimal.ZERO;
    for (LedgerPosition position : openPositions.values()) {
      totalExposure = totalExposure.add(position.notional());
    }
    BigDecimal exposureRatio =
        currentBalance.signum() > 0
            ? totalExposure.divide(currentBalance, MC)
            : BigDecimal.ZERO;
    BigDecimal riskUtilization =
        BigDecimal.valueOf(openPositions.size())
            .multiply(HUNDRED)
            .divide(BigDecimal.valueOf(parameters.maxOpenPositions()), MC);
    return new RiskMetrics(
        currentBalance,
        initialBalance,
        dailyPnl,
        dailyPnl.multiply(HUNDRED).divide(initialBalance, MC),
        currentBalance.subtract(initialBalance).multiply(HUNDRED).divide(initialBalance, MC),
        openPositions.size(),
        riskUtilization,
        totalExposure,
        exposureRatio,
        parameters.paperTrading(),
        lastUpdate);
  }

  private BigDecimal maxPositionValue() {
    return currentBalance.multiply(parameters.maxPositionFraction());
  }

  private void appendEvent(RiskEventType type, String symbol, Map<String, Object> attributes) {
    RiskEvent event = new RiskEvent(type, symbol, attributes, clock.instant());
    events.append(event);
    eventListener.onEvent(event);
  }

  private static String money(BigDecimal value) {
    return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
  }

  private static void requireSymbol(String symbol) {
    if (symbol == null || symbol.isBlank()) {
      throw new RiskDomainException("symbol must not be blank");
    }
  }

  private static void requirePositive(BigDecimal value, String name) {
    if (value == null || value.signum() <= 0) {
      throw new RiskDomainException(name + " must be > 0");
    }
  }

  private static void requireNonNegativeIfPresent(BigDecimal value, String name) {
    if (value != null && value.signum() < 0) {
      throw new RiskDomainException(name + " must be >= 0");
    }
  }
}
