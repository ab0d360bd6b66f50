package com.riskrecon.worker.reconcile;

import com.riskrecon.integration.venue.VenueConnectorException;
import com.riskrecon.integration.venue.VenueOrderSnapshot;
import com.riskrecon.integration.venue.VenuePositionSnapshot;
import com.riskrecon.worker.health.TransportStatus;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

record VenueFetchResult(
    String venue,
    List<VenuePositionSnapshot> positions,
    List<VenueOrderSnapshot> orders,
    Map<String, BigDecimal> markPrices,
    TransportStatus transport,
    String transportError,
    double latencyMillis,
    VenueConnectorException failure) {

  static VenueFetchResult success(
      String venue,
      List<VenuePositionSnapshot> positions,
      List<VenueOrderSnapshot> orders,
      Map<String, BigDecimal> markPrices,
      TransportStatus transport,
      String transportError,
      double latencyMillis) {
    return new VenueFetchResult(
        venue,
        positions == null ? List.of() : positions,
        orders == null ? List.of() : orders,
        Map.copyOf(markPrices),
        transport,
        transportError,
        latencyMillis,
        null);
  }

  static VenueFetchResult failure(String venue, VenueConnectorException failure) {
    return new VenueFetchResult(
        venue, List.of(), List.of(), Map.of(), TransportStatus.down(), null, 0.0, failure);
  }

  boolean succeeded() {
    return failure == null;
  }
}
