package com.riskrecon.domain.risk;

public enum PositionAction {
  OPEN,
  CLOSE
}
