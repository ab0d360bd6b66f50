package com.riskrecon.domain.risk;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Venue-agnostic ledger of balance, daily PnL and open positions keyed by symbol.
 *
 * <p>Every mutating and every metrics-reading operation is atomic: callers never observe a
 * partially applied update. Limit breaches are reported through {@link TradeValidation}, never
 * thrown. {@link RiskDomainException} is reserved for calls that break the contract (blank
 * symbol, non-positive price or quantity).
 */
public interface RiskLedger {

  /**
   * Units to buy or sell so that hitting {@code stopPrice} loses at most the per-trade risk
   * budget. Returns zero when entry and stop coincide.
   *
   * @param volatility optional, ignored when volatility adjustment is disabled
   */
  BigDecimal sizePosition(
      String symbol, BigDecimal entryPrice, BigDecimal stopPrice, BigDecimal volatility);

  TradeValidation validateTrade(
      String symbol,
      PositionSide side,
      BigDecimal quantity,
      BigDecimal price,
      MarketConditions marketConditions);

  StopTakeLevels stopTakeLevels(BigDecimal entryPrice, PositionSide side, BigDecimal volatility);

  void updateBalance(BigDecimal newBalance);

  void addPosition(
      String symbol,
      PositionSide side,
      BigDecimal quantity,
      BigDecimal entryPrice,
      Map<String, String> metadata);

  /**
   * Drops the position for {@code symbol}. With an exit price the realized PnL is written to the
   * position history.
   *
   * @return {@code true} if a position was open for the symbol
   */
  boolean removePosition(String symbol, BigDecimal exitPrice);

  RiskMetrics metrics();

  /** Diagnostics only; the report is bounded and is not meant to rebuild ledger state. */
  RiskReport exportReport();

  void resetDaily();

  List<LedgerPosition> openPositions();

  List<RiskEvent> recentEvents(int limit);
}
