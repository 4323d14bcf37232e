package com.slidepilot.backend.conversation;

import com.slidepilot.backend.common.exception.ErrorCode;
import com.slidepilot.backend.common.exception.NotFoundException;
import com.slidepilot.backend.common.exception.SlidePilotException;
import com.slidepilot.backend.conversation.api.TurnEvent;
import com.slidepilot.backend.generation.GenerationClient;
import com.slidepilot.backend.generation.config.GenerationProperties;
import com.slidepilot.backend.generation.model.GenerationFragment;
import com.slidepilot.backend.generation.model.GenerationOptions;
import com.slidepilot.backend.session.SessionStore;
import com.slidepilot.backend.session.domain.ChatRole;
import com.slidepilot.backend.session.domain.ConversationSession;
import com.slidepilot.backend.template.TemplateCatalog;
import com.slidepilot.backend.template.TemplateDefinition;
import com.slidepilot.backend.template.TemplateDefinition.GuidedConversation;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Drives guided conversations: opens sessions with the template greeting and runs one streamed
 * model turn per user message.
 *
 * <p>A turn is committed only after the backend has sent its final fragment and every token has
 * been delivered. A stream that closes without a final fragment counts as a failed turn. The user message and the assistant reply are stored together, so a turn that fails
 * or is cancelled leaves the transcript exactly as it was.
 */
@Service
public class ConversationService {

  private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

  private final SessionStore sessionStore;
  private final TemplateCatalog templateCatalog;
  private final GenerationClient generationClient;
  private final TurnPromptBuilder promptBuilder;
  private final GenerationProperties generationProperties;

  public ConversationService(
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

  public ConversationStart start(String templateKey) {
    TemplateDefinition template = templateCatalog.requireGuided(templateKey);
    String greeting = template.guidedConversation().greeting();

    ConversationSession session = sessionStore.create(template.key());
    sessionStore
        .addMessage(session.id(), ChatRole.ASSISTANT, greeting)
        .orElseThrow(() -> NotFoundException.session(session.id()));

    log.info("Started chat session {} for template '{}'", session.id(), template.key());
    return new ConversationStart(session.id(), greeting);
  }

  /**
   * Runs one turn. The session and message are checked eagerly, so an unknown session fails
   * before any stream is opened; everything after that is reported as events.
   *
   * @throws NotFoundException if the session does not exist or has expired
   * @throws SlidePilotException with {@link ErrorCode#INVALID_REQUEST} for a blank message
   */
  public Flux<TurnEvent> streamTurn(String sessionId, String userMessage) {
    if (!StringUtils.hasText(userMessage)) {
      throw new SlidePilotException(ErrorCode.INVALID_REQUEST, "Message must not be blank");
    }
    ConversationSession session =
        sessionStore.get(sessionId).orElseThrow(() -> NotFoundException.session(sessionId));

    String system =
        templateCatalog
            .find(session.template())
            .flatMap(TemplateDefinition::findGuidedConversation)
            .map(GuidedConversation::conversationSystemPrompt)
            .orElse(null);
    String prompt = promptBuilder.buildTurnPrompt(session.messages(), userMessage);
    GenerationOptions options =
        GenerationOptions.withTemperature(generationProperties.getTemperature());

    return Flux.defer(
        () -> {
          CompletionMarkerFilter filter = new CompletionMarkerFilter();
          StringBuilder fullResponse = new StringBuilder();
          AtomicBoolean finished = new AtomicBoolean();

          Flux<TurnEvent> tokens =
              generationClient
                  .stream(prompt, system, options)
                  .concatMap(
                      fragment -> {
                        if (fragment.done()) {
                          finished.set(true);
                        }
                        return forward(sessionId, fragment, filter, fullResponse);
                      })
                  .concatWith(
                      Mono.fromSupplier(filter::flush).flatMap(tail -> token(sessionId, tail)));

          Mono<TurnEvent> commit =
              Mono.fromSupplier(
                  () ->
                      finished.get()
                          ? commit(sessionId, userMessage, fullResponse.toString(), filter)
                          : abandonTurn(sessionId));

          return tokens
              .concatWith(commit)
              .onErrorResume(error -> Mono.just(failTurn(sessionId, error)))
              .doOnCancel(
                  () -> log.info("Turn for session {} cancelled, nothing committed", sessionId));
        });
  }

  private Flux<TurnEvent> forward(
      String sessionId,
      GenerationFragment fragment,
      CompletionMarkerFilter filter,
      StringBuilder fullResponse) {
    fullResponse.append(fragment.text());
    if (log.isDebugEnabled()) {
      log.debug("Stream chunk for session {}: {}", sessionId, fragment.text());
    }
    String visible = filter.accept(fragment.text());
    return token(sessionId, visible).flux();
  }

  private Mono<TurnEvent> token(String sessionId, String text) {
    return text.isEmpty() ? Mono.empty() : Mono.just(TurnEvent.token(sessionId, text));
  }

  private TurnEvent commit(
      String sessionId, String userMessage, String fullResponse, CompletionMarkerFilter filter) {
    boolean ready = filter.isMarkerSeen();
    String reply =
        CompletionMarkerFilter.strip(fullResponse, CompletionMarkerFilter.READY_FOR_DRAFT).strip();

    if (!sessionStore.appendExchange(sessionId, userMessage, reply)) {
      log.warn("Session {} disappeared before the turn could be committed", sessionId);
      return TurnEvent.error(
          sessionId,
          ErrorCode.SESSION_NOT_FOUND,
          "Session '" + sessionId + "' not found or expired");
    }
    if (ready) {
      sessionStore.setReady(sessionId, true);
    }
    log.info("Chat message processed for session {}, readyForDraft={}", sessionId, ready);
    return TurnEvent.complete(sessionId, reply, ready);
  }

  private TurnEvent abandonTurn(String sessionId) {
    log.warn("Generation stream for session {} ended before its final fragment", sessionId);
    return TurnEvent.error(
        sessionId, ErrorCode.BACKEND_UNAVAILABLE, ErrorCode.BACKEND_UNAVAILABLE.defaultMessage());
  }

  private TurnEvent failTurn(String sessionId, Throwable error) {
    if (error instanceof SlidePilotException slidePilotException) {
      log.warn("Turn for session {} failed: {}", sessionId, error.getMessage());
      return TurnEvent.error(
          sessionId, slidePilotException.getCode(), slidePilotException.getMessage());
    }
    log.error("Generation stream failed for session {}", sessionId, error);
    return TurnEvent.error(
        sessionId, ErrorCode.BACKEND_UNAVAILABLE, ErrorCode.BACKEND_UNAVAILABLE.defaultMessage());
  }

  /** Identifier of a freshly started session and the greeting already stored in it. */
  public record ConversationStart(String sessionId, String greeting) {}
}
