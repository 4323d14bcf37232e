package com.slidepilot.backend.draft;

import com.slidepilot.backend.common.exception.NotFoundException;
import com.slidepilot.backend.conversation.TurnPromptBuilder;
import com.slidepilot.backend.generation.GenerationClient;
import com.slidepilot.backend.generation.config.GenerationProperties;
import com.slidepilot.backend.generation.model.GenerationResult;
import com.slidepilot.backend.generation.model.PresentationPayload;
import com.slidepilot.backend.generation.model.PresentationSchema;
import com.slidepilot.backend.generation.model.StructuredRequest;
import com.slidepilot.backend.session.SessionStore;
import com.slidepilot.backend.session.domain.ConversationSession;
import com.slidepilot.backend.session.domain.PresentationDraft;
import com.slidepilot.backend.template.TemplateCatalog;
import com.slidepilot.backend.template.TemplateDefinition;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Service;

/**
 * Turns a session transcript into a validated presentation draft and stores it on the session.
 * Failures are returned as values and leave the session untouched.
 */
@Service
public class DraftAssembler {

  private static final Logger log = LoggerFactory.getLogger(DraftAssembler.class);

  private final SessionStore sessionStore;
  private final TemplateCatalog templateCatalog;
  private final GenerationClient generationClient;
  private final TurnPromptBuilder promptBuilder;
  private final GenerationProperties generationProperties;
  private final BeanOutputConverter<PresentationPayload> outputConverter =
      new BeanOutputConverter<>(PresentationPayload.class);

  public DraftAssembler(
      SessionStore sessionStore,
      TemplateCatalog templateCatalog,
      GenerationClient generationClient,
      TurnPromptBuilder promptBuilder,
      GenerationProperties generationProperties) {
    this.sessionStore = sessionStore;
    this.templateCatalog = templateCatalog;
    this.generationClient = generationClient;
    this.promptBuilder = promptBuilder;
    this.generationProperties = generationProperties;
  }

  /**
   * @throws NotFoundException if the session is unknown, expired, or disappears before the draft
   *     can be stored
   */
  public GenerationResult<PresentationDraft> assemble(String sessionId) {
    ConversationSession session =
        sessionStore.get(sessionId).orElseThrow(() -> NotFoundException.session(sessionId));

    PresentationSchema schema = PresentationSchema.draft();
    StructuredRequest request =
        new StructuredRequest(
            buildPrompt(session, schema),
            buildSystemPrompt(session),
            schema,
            generationProperties.getDraftTemperature(),
            null);

    GenerationResult<PresentationDraft> result = generationClient.generateStructured(request);
    if (!result.isSuccess()) {
      log.warn(
          "Failed to generate draft for session {}: {} {}",
          sessionId,
          result.failure().kind(),
          result.failure().message());
      return result;
    }

    PresentationDraft draft = result.value();
    if (!sessionStore.setDraft(sessionId, draft.title(), draft.slides())) {
      throw NotFoundException.session(sessionId);
    }
    sessionStore.mergeExtractedInfo(
        sessionId, Map.of("title", draft.title(), "slideCount", draft.slides().size()));
    log.info("Generated draft for session {}: {} slides", sessionId, draft.slides().size());
    return result;
  }

  String buildPrompt(ConversationSession session, PresentationSchema schema) {
    return """
        Based on this conversation, create a presentation draft:

        %s

        Generate a professional presentation structure with %d-%d slides. The first slide must \
        be of type "title", the last slide of type "summary" and every slide in between of type \
        "content". Output valid JSON only.
        """
        .formatted(
            promptBuilder.transcript(session.messages()), schema.minSlides(), schema.maxSlides());
  }

  String buildSystemPrompt(ConversationSession session) {
    TemplateDefinition template = templateCatalog.find(session.template()).orElse(null);
    String templateName = template != null ? template.name() : "General";
    List<String> requiredInfo =
        template != null
            ? template
                .findGuidedConversation()
                .map(TemplateDefinition.GuidedConversation::requiredInfo)
                .orElse(List.of())
            : List.of();

    StringBuilder system = new StringBuilder();
    system
        .append("You are creating a presentation draft based on a conversation.\n")
        .append("Use the information gathered to create a structured presentation outline.\n\n")
        .append("Template: ")
        .append(templateName)
        .append('\n');
    if (!requiredInfo.isEmpty()) {
      system.append("Information to cover: ").append(String.join(", ", requiredInfo)).append('\n');
    }
    system.append('\n').append(outputConverter.getFormat());
    return system.toString();
  }
}
