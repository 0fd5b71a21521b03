package com.sidexkit.engine.executor;

import com.sidexkit.engine.domain.Venue;
import com.sidexkit.engine.executor.venue.VenueRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "executor.ledger.enabled=false",
    "server.port=0"
})
class ExecutorServiceApplicationTests {

  @Autowired
  private VenueRegistry venues;

  @Test
  void contextLoadsWithEveryVenue() {
    assertThat(venues.venues()).containsExactlyInAnyOrder(Venue.BYBIT, Venue.HYPERLIQUID, Venue.SOLANA_JUPITER);
  }
}
