package com.riskrecon.integration.venue;

import java.math.BigDecimal;

/**
 * Open or recently completed order as reported by a venue.
 *
 * @param referencePrice price the order was decided at, when the venue echoes it back
 */
public record VenueOrderSnapshot(
    String orderId,
    String symbol,
    String side,
    BigDecimal amount,
    BigDecimal filled,
    String status,
    BigDecimal price,
    BigDecimal average,
    BigDecimal referencePrice) {

  /** Average execution price, falling back to the limit price. */
  public BigDecimal fillPrice() {
    return average != null ? average : price;
  }

  public BigDecimal resolvedReferencePrice() {
    return referencePrice != null ? referencePrice : price;
  }
}
