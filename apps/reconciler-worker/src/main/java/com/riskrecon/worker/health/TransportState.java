package com.riskrecon.worker.health;

import java.util.Locale;

public enum TransportState {
  UP,
  DOWN,
  UNKNOWN;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
