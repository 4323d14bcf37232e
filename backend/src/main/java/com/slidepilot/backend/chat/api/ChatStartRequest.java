package com.slidepilot.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Starts a guided conversation for a presentation template.")
public record ChatStartRequest(
    @Schema(
            description = "Template key; the configured default template is used when omitted.",
            example = "general")
        String template) {}
