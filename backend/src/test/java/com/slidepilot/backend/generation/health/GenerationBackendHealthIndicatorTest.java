package com.slidepilot.backend.generation.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.slidepilot.backend.generation.GenerationClient;
import com.slidepilot.backend.generation.config.GenerationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

@ExtendWith(MockitoExtension.class)
class GenerationBackendHealthIndicatorTest {

  @Mock private GenerationClient generationClient;

  private GenerationBackendHealthIndicator indicator;

  @BeforeEach
  void setUp() {
    GenerationProperties properties = new GenerationProperties();
    properties.setBaseUrl("http://ollama.test");
    properties.setModel("llama3.1:8b");
    indicator = new GenerationBackendHealthIndicator(generationClient, properties);
  }

  @Test
  void upWhenBackendAnswers() {
    when(generationClient.isAvailable()).thenReturn(true);

    Health health = indicator.health();

    assertThat(health.getStatus()).isEqualTo(Status.UP);
    assertThat(health.getDetails())
        .containsEntry("baseUrl", "http://ollama.test")
        .containsEntry("model", "llama3.1:8b");
  }

  @Test
  void downWhenBackendUnreachable() {
    when(generationClient.isAvailable()).thenReturn(false);

    assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
  }
}
