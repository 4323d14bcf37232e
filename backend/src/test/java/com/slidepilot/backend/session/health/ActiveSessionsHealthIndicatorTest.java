package com.slidepilot.backend.session.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.slidepilot.backend.session.SessionStore;
import com.slidepilot.backend.support.MutableClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

class ActiveSessionsHealthIndicatorTest {

  @Test
  void reportsLiveSessionsAndGauge() {
    MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    SessionStore store = new SessionStore(Duration.ofMinutes(30), clock);
    MeterRegistry registry = new SimpleMeterRegistry();
    ActiveSessionsHealthIndicator indicator = new ActiveSessionsHealthIndicator(store, registry);

    store.create("general");
    clock.advance(Duration.ofMinutes(31));
    store.create("general");

    Health health = indicator.health();
    assertThat(health.getStatus()).isEqualTo(Status.UP);
    assertThat(health.getDetails()).containsEntry("activeSessions", 1).containsEntry("ttl", "PT30M");
    assertThat(registry.find("slidepilot_sessions_active").gauge().value()).isEqualTo(1.0);
  }
}
