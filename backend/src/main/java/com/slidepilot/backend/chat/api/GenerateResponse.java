package com.slidepilot.backend.chat.api;

import com.slidepilot.backend.session.domain.PresentationDraft;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Result of rendering the approved draft.")
public record GenerateResponse(
    boolean success,
    @Schema(description = "Identifier of the rendered artifact.") String fileId,
    @Schema(description = "Relative URL the artifact can be downloaded from.") String downloadUrl,
    @Schema(description = "Draft the artifact was rendered from.") PresentationDraft preview) {}
