package com.riskrecon.integration.venue;

import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Read-only view of one trading venue.
 *
 * <p>Tickers and open orders are mandatory. Open positions and transport ping are advertised
 * through {@link #capabilities()}; the defaults return nothing so callers can branch on the flags
 * instead of probing. Implementations signal transport failures with {@link
 * VenueConnectorException}.
 */
public interface VenueAdapter {
  String name();

  Set<VenueCapability> capabilities();

  VenueTicker fetchTicker(String symbol);

  List<VenueOrderSnapshot> fetchOpenOrders();

  default List<VenuePositionSnapshot> fetchOpenPositions() {
    return List.of();
  }

  /** Round trip of the streaming transport in milliseconds, empty when unsupported. */
  default OptionalDouble pingTransport() {
    return OptionalDouble.empty();
  }

  default boolean supports(VenueCapability capability) {
    return capabilities().contains(capability);
  }
}
