package com.slidepilot.backend.generation.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "app.generation")
@Validated
public class GenerationProperties {

  /** Base URL of the Ollama-compatible generation backend. */
  @NotBlank private String baseUrl = "http://localhost:11434";

  /** Model identifier sent with every request. */
  @NotBlank private String model = "llama3.1:8b";

  private Duration connectTimeout = Duration.ofSeconds(10);

  /**
   * Longest silence tolerated while reading a response. Streams stay open as long as fragments
   * keep arriving within this window.
   */
  private Duration readTimeout = Duration.ofSeconds(120);

  /** Sampling temperature for conversation turns. */
  private double temperature = 0.15;

  /** Sampling temperature for structured draft generation. */
  private double draftTemperature = 0.15;

  /** Context window size ({@code num_ctx}) requested from the backend. */
  private int contextWindow = 8192;

  private Retry retry = new Retry();

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  public void setReadTimeout(Duration readTimeout) {
    this.readTimeout = readTimeout;
  }

  public double getTemperature() {
    return temperature;
  }

  public void setTemperature(double temperature) {
    this.temperature = temperature;
  }

  public double getDraftTemperature() {
    return draftTemperature;
  }

  public void setDraftTemperature(double draftTemperature) {
    this.draftTemperature = draftTemperature;
  }

  public int getContextWindow() {
    return contextWindow;
  }

  public void setContextWindow(int contextWindow) {
    this.contextWindow = contextWindow;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  /** Retry policy for non-streaming calls. Streams are never retried. */
  public static class Retry {

    private int attempts = 3;
    private Duration initialDelay = Duration.ofSeconds(1);
    private double multiplier = 2.0;
    private Duration maxDelay = Duration.ofSeconds(10);
    private List<Integer> retryableStatuses = new ArrayList<>(List.of(429, 500, 502, 503, 504));

    public int getAttempts() {
      return attempts;
    }

    public void setAttempts(int attempts) {
      this.attempts = attempts;
    }

    public Duration getInitialDelay() {
      return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }

    public List<Integer> getRetryableStatuses() {
      return retryableStatuses;
    }

    public void setRetryableStatuses(List<Integer> retryableStatuses) {
      this.retryableStatuses = retryableStatuses;
    }
  }
}
