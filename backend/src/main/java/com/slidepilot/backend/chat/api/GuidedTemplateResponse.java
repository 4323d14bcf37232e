package com.slidepilot.backend.chat.api;

import com.slidepilot.backend.template.TemplateDefinition;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

@Schema(description = "Template that can drive a guided conversation.")
public record GuidedTemplateResponse(
    @Schema(example = "general") String key,
    String name,
    String description,
    @Schema(description = "Information the assistant tries to collect before drafting.")
        List<String> requiredInfo) {

  public static GuidedTemplateResponse from(TemplateDefinition template) {
    return new GuidedTemplateResponse(
        template.key(),
        template.name(),
        template.description(),
        template.guidedConversation().requiredInfo());
  }
}
