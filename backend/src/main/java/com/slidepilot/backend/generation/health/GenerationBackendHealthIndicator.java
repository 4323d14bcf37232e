package com.slidepilot.backend.generation.health;

import com.slidepilot.backend.generation.GenerationClient;
import com.slidepilot.backend.generation.config.GenerationProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class GenerationBackendHealthIndicator implements HealthIndicator {

  private final GenerationClient generationClient;
  private final GenerationProperties properties;

  public GenerationBackendHealthIndicator(
      GenerationClient generationClient, GenerationProperties properties) {
    this.generationClient = generationClient;
    this.properties = properties;
  }

  @Override
  public Health health() {
    Health.Builder builder =
        generationClient.isAvailable() ? Health.up() : Health.down();
    return builder
        .withDetail("baseUrl", properties.getBaseUrl())
        .withDetail("model", properties.getModel())
        .build();
  }
}
