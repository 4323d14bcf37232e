package com.slidepilot.backend.generation.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

/** Raw presentation structure as returned by the model, before schema validation. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PresentationPayload(
    @JsonPropertyDescription("Presentation title") @NotBlank @Size(max = 200) String title,
    @JsonPropertyDescription("Ordered slides") @NotNull List<@Valid @NotNull SlidePayload> slides) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record SlidePayload(
      @JsonPropertyDescription("One of: title, content, summary") @NotBlank String type,
      @JsonPropertyDescription("Slide heading") @NotBlank @Size(max = 200) String heading,
      @JsonPropertyDescription("Optional subheading") @Size(max = 300) String subheading,
      @JsonPropertyDescription("Optional bullet points")
          @Size(max = 10)
          List<@NotBlank @Size(max = 300) String> bullets) {}
}
