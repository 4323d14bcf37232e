package com.slidepilot.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Newly created session and the assistant greeting stored as its first message.")
public record ChatStartResponse(
    @Schema(
            description = "Session identifier.",
            example = "9b2d1d60-12f1-4f9d-9c70-4ce2c2b6817b")
        String sessionId,
    @Schema(description = "Assistant greeting.") String message) {}
