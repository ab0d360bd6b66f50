package com.riskrecon.domain.risk;

public enum RiskEventType {
  POSITION_SIZING,
  TRADE_VALIDATION,
  BALANCE_UPDATE,
  POSITION_OPENED,
  POSITION_CLOSED,
  DAILY_RESET
}
