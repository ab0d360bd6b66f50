package com.riskrecon.integration.venue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Name-unique set of venues, iterated in registration order. */
public class VenueRegistry {
  private final Map<String, VenueAdapter> venues = new LinkedHashMap<>();

  public VenueRegistry() {}

  public VenueRegistry(Collection<? extends VenueAdapter> adapters) {
    adapters.forEach(this::register);
  }

  public synchronized void register(VenueAdapter adapter) {
    Objects.requireNonNull(adapter, "adapter must not be null");
    String name = adapter.name();
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("venue name must not be blank");
    }
    if (venues.putIfAbsent(name, adapter) != null) {
      throw new IllegalArgumentException("Duplicate venue name: " + name);
    }
  }

  public synchronized Optional<VenueAdapter> find(String name) {
    return Optional.ofNullable(venues.get(name));
  }

  public synchronized List<VenueAdapter> all() {
    return List.copyOf(venues.values());
  }

  public synchronized List<String> names() {
    return new ArrayList<>(venues.keySet());
  }

  public synchronized boolean isEmpty() {
    return venues.isEmpty();
  }
}
