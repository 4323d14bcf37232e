package com.slidepilot.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(description = "User message for the next conversation turn.")
public record ChatMessageRequest(
    @Schema(
            description = "Message text.",
            example = "I need a kickoff deck for our data platform migration.",
            requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Message must not be blank")
        @Size(max = 4000, message = "Message must not exceed 4000 characters")
        String message) {}
