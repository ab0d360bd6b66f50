package com.riskrecon.integration.venue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class VenueRegistryTest {
  @Test
  void shouldKeepRegistrationOrder() {
    VenueRegistry registry =
        new VenueRegistry(
            List.of(new PaperVenueAdapter("paper-b"), new PaperVenueAdapter("paper-a")));

    assertEquals(List.of("paper-b", "paper-a"), registry.names());
    assertTrue(registry.find("paper-a").isPresent());
    assertTrue(registry.find("missing").isEmpty());
  }

  @Test
  void shouldRejectDuplicateVenueName() {
    VenueRegistry registry = new VenueRegistry();
    registry.register(new PaperVenueAdapter("paper"));

    assertThrows(
        IllegalArgumentException.class, () -> registry.register(new PaperVenueAdapter("paper")));
  }
}
