package com.slidepilot.backend.template;

import java.util.List;
import java.util.Optional;

public record TemplateDefinition(
    String key, String name, String description, GuidedConversation guidedConversation) {

  public Optional<GuidedConversation> findGuidedConversation() {
    return Optional.ofNullable(guidedConversation);
  }

  public boolean supportsGuidedMode() {
    return guidedConversation != null;
  }

  /** Guided-mode settings; present only when the template enables guided mode. */
  public record GuidedConversation(
      String greeting, String conversationSystemPrompt, List<String> requiredInfo) {

    public GuidedConversation {
      requiredInfo = requiredInfo != null ? List.copyOf(requiredInfo) : List.of();
    }
  }
}
