package com.riskrecon.worker.reconcile;

import com.riskrecon.integration.venue.VenueOrderSnapshot;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;

final class FillDetector {
  private static final Set<String> FILLED_STATUSES = Set.of("filled", "closed");
  private static final BigDecimal FILL_THRESHOLD = new BigDecimal("0.99");

  private FillDetector() {}

  static boolean isFilled(VenueOrderSnapshot order) {
    if (order.status() != null
        && FILLED_STATUSES.contains(order.status().trim().toLowerCase(Locale.ROOT))) {
      return true;
    }
    BigDecimal amount = order.amount();
    BigDecimal filled = order.filled();
    if (amount == null || filled == null || amount.signum() <= 0) {
      return false;
    }
    return filled.compareTo(amount.multiply(FILL_THRESHOLD)) >= 0;
  }
}
