package com.slidepilot.backend.session.health;

import com.slidepilot.backend.session.SessionStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** Reports the number of live sessions; reading the count also sweeps expired ones. */
@Component
public class ActiveSessionsHealthIndicator implements HealthIndicator {

  private final SessionStore sessionStore;

  public ActiveSessionsHealthIndicator(SessionStore sessionStore, MeterRegistry meterRegistry) {
    this.sessionStore = sessionStore;
    Gauge.builder("slidepilot_sessions_active", sessionStore, SessionStore::activeCount)
        .description("Number of live guided conversation sessions")
        .register(meterRegistry);
  }

  @Override
  public Health health() {
    return Health.up()
        .withDetail("activeSessions", sessionStore.activeCount())
        .withDetail("ttl", sessionStore.getTtl().toString())
        .build();
  }
}
