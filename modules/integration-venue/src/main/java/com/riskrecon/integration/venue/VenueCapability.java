package com.riskrecon.integration.venue;

/** Optional operations a venue may support beyond tickers and open orders. */
public enum VenueCapability {
  OPEN_POSITIONS,
  TRANSPORT_PING
}
