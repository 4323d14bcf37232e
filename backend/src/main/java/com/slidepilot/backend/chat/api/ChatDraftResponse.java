package com.slidepilot.backend.chat.api;

import com.slidepilot.backend.session.domain.PresentationDraft;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Draft generated from the conversation and stored on the session.")
public record ChatDraftResponse(
    @Schema(description = "Session identifier.") String sessionId,
    @Schema(description = "Presentation outline.") PresentationDraft draft) {}
