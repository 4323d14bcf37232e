package com.slidepilot.backend.quick.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.quick")
public class QuickGenerationProperties {

  /** Template used when a quick request names none. */
  @NotBlank private String defaultTemplate = "quick-summary";

  @NotBlank private String defaultLanguage = "en";

  @Min(1)
  private int defaultSlides = 3;

  /** Requested slide counts above this value are lowered to it. */
  @Min(1)
  private int maxSlides = 10;

  public String getDefaultTemplate() {
    return defaultTemplate;
  }

  public void setDefaultTemplate(String defaultTemplate) {
    this.defaultTemplate = defaultTemplate;
  }

  public String getDefaultLanguage() {
    return defaultLanguage;
  }

  public void setDefaultLanguage(String defaultLanguage) {
    this.defaultLanguage = defaultLanguage;
  }

  public int getDefaultSlides() {
    return defaultSlides;
  }

  public void setDefaultSlides(int defaultSlides) {
    this.defaultSlides = defaultSlides;
  }

  public int getMaxSlides() {
    return maxSlides;
  }

  public void setMaxSlides(int maxSlides) {
    this.maxSlides = maxSlides;
  }
}
