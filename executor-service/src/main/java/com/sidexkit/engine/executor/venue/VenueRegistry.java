package com.sidexkit.engine.executor.venue;

import com.sidexkit.engine.domain.Venue;
import com.sidexkit.engine.error.InvalidIntentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
@Slf4j
public class VenueRegistry {

  private final Map<Venue, VenueAdapter<?, ?, ?>> adapters = new EnumMap<>(Venue.class);

  public VenueRegistry(List<VenueAdapter<?, ?, ?>> adapters) {
    for (VenueAdapter<?, ?, ?> adapter : adapters) {
      VenueAdapter<?, ?, ?> previous = this.adapters.put(adapter.venue(), adapter);
      if (previous != null) {
        throw new IllegalStateException("Duplicate adapter for venue " + adapter.venue());
      }
    }
    log.info("venue registry: adapters={}", this.adapters.keySet());
  }

  public VenueAdapter<?, ?, ?> adapterFor(Venue venue) {
    VenueAdapter<?, ?, ?> adapter = adapters.get(venue);
    if (adapter == null) {
      throw new InvalidIntentException("venue not supported: " + venue);
    }
    return adapter;
  }

  public Set<Venue> venues() {
    return Set.copyOf(adapters.keySet());
  }
}
