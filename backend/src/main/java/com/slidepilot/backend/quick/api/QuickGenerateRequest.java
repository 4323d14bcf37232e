package com.slidepilot.backend.quick.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

@Schema(description = "One-shot presentation request without a guided conversation.")
public record QuickGenerateRequest(
    @Schema(
            description = "Presentation topic.",
            example = "AI in Healthcare",
            requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Topic must not be blank")
        @Size(max = 500, message = "Topic must not exceed 500 characters")
        String topic,
    @Schema(description = "Language of the slide content.", example = "en")
        @Size(max = 10, message = "Language must not exceed 10 characters")
        String language,
    @Schema(description = "Number of slides; capped at the configured maximum.", example = "5")
        @Positive(message = "Slides must be positive")
        Integer slides,
    @Schema(description = "Sampling temperature override.", example = "0.15")
        @DecimalMin(value = "0.0", message = "Temperature must be at least 0.0")
        @DecimalMax(value = "2.0", message = "Temperature must be at most 2.0")
        Double temperature,
    @Schema(description = "Context window override.", example = "8192")
        @Positive(message = "Context window must be positive")
        Integer contextWindow,
    @Schema(description = "Template key; the configured quick template when omitted.")
        String template) {}
