package com.slidepilot.backend.generation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slidepilot.backend.generation.GenerationClient;
import com.slidepilot.backend.generation.GenerationMetrics;
import com.slidepilot.backend.generation.OllamaGenerationClient;
import com.slidepilot.backend.generation.PresentationContentValidator;
import com.slidepilot.backend.generation.StructuredOutputParser;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Validator;
import java.util.Set;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

@Configuration
@EnableConfigurationProperties(GenerationProperties.class)
public class GenerationClientConfiguration {

  private static final long MAX_BACKOFF_MS = 10_000L;

  @Bean
  WebClient generationWebClient(GenerationProperties properties) {
    return WebClient.builder()
        .baseUrl(properties.getBaseUrl())
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .clientConnector(
            new ReactorClientHttpConnectorBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .readTimeout(properties.getReadTimeout())
                .build())
        .build();
  }

  @Bean
  RetryTemplate generationRetryTemplate(GenerationProperties properties) {
    return buildRetryTemplate(properties.getRetry());
  }

  @Bean
  StructuredOutputParser structuredOutputParser(ObjectMapper objectMapper) {
    return new StructuredOutputParser(objectMapper);
  }

  @Bean
  PresentationContentValidator presentationContentValidator(Validator validator) {
    return new PresentationContentValidator(validator);
  }

  @Bean
  GenerationMetrics generationMetrics(MeterRegistry meterRegistry) {
    return new GenerationMetrics(meterRegistry);
  }

  @Bean
  GenerationClient generationClient(
      WebClient generationWebClient,
      RetryTemplate generationRetryTemplate,
      ObjectMapper objectMapper,
      StructuredOutputParser structuredOutputParser,
      PresentationContentValidator presentationContentValidator,
      GenerationProperties properties,
      GenerationMetrics generationMetrics) {
    return new OllamaGenerationClient(
        generationWebClient,
        generationRetryTemplate,
        objectMapper,
        structuredOutputParser,
        presentationContentValidator,
        properties,
        generationMetrics);
  }

  public static RetryTemplate buildRetryTemplate(GenerationProperties.Retry retryConfig) {
    int attempts = retryConfig != null ? Math.max(1, retryConfig.getAttempts()) : 3;
    long initialInterval =
        retryConfig != null && retryConfig.getInitialDelay() != null
            ? Math.max(1L, retryConfig.getInitialDelay().toMillis())
            : 1_000L;
    double multiplier = retryConfig != null ? retryConfig.getMultiplier() : 2.0;
    long maxInterval =
        retryConfig != null && retryConfig.getMaxDelay() != null
            ? Math.min(retryConfig.getMaxDelay().toMillis(), MAX_BACKOFF_MS)
            : MAX_BACKOFF_MS;
    Set<Integer> retryableStatuses =
        retryConfig != null && retryConfig.getRetryableStatuses() != null
            ? Set.copyOf(retryConfig.getRetryableStatuses())
            : Set.of(429, 500, 502, 503, 504);

    RetryTemplateBuilder builder = RetryTemplate.builder().maxAttempts(attempts);
    if (multiplier > 1.0 && maxInterval > initialInterval) {
      builder = builder.exponentialBackoff(initialInterval, multiplier, maxInterval);
    } else {
      builder = builder.fixedBackoff(initialInterval);
    }
    return builder.retryOn(throwable -> isRetryable(throwable, retryableStatuses)).build();
  }

  static boolean isRetryable(Throwable throwable, Set<Integer> retryableStatuses) {
    if (throwable instanceof WebClientResponseException responseException) {
      return retryableStatuses.contains(responseException.getStatusCode().value());
    }
    return throwable instanceof WebClientRequestException;
  }
}
