package com.slidepilot.backend.quick.controller;

import com.slidepilot.backend.chat.api.GenerateResponse;
import com.slidepilot.backend.quick.QuickGenerationService;
import com.slidepilot.backend.quick.QuickGenerationService.QuickPresentation;
import com.slidepilot.backend.quick.api.QuickGenerateRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Validated
@Tag(name = "generation", description = "One-shot presentation generation")
public class QuickGenerationController {

  private final QuickGenerationService quickGenerationService;

  public QuickGenerationController(QuickGenerationService quickGenerationService) {
    this.quickGenerationService = quickGenerationService;
  }

  @PostMapping(value = "/generate", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Generate a presentation from a topic")
  public GenerateResponse generate(@RequestBody @Valid QuickGenerateRequest request) {
    QuickPresentation presentation = quickGenerationService.generate(request);
    return new GenerateResponse(
        true,
        presentation.artifact().fileId(),
        presentation.artifact().downloadUrl(),
        presentation.preview());
  }
}
