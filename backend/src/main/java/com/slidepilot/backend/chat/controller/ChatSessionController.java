package com.slidepilot.backend.chat.controller;

import com.slidepilot.backend.chat.api.ChatDraftResponse;
import com.slidepilot.backend.chat.api.ChatMessageRequest;
import com.slidepilot.backend.chat.api.ChatSessionInfo;
import com.slidepilot.backend.chat.api.ChatStartRequest;
import com.slidepilot.backend.chat.api.ChatStartResponse;
import com.slidepilot.backend.chat.api.DeleteSessionResponse;
import com.slidepilot.backend.chat.api.GenerateResponse;
import com.slidepilot.backend.chat.api.GuidedTemplateResponse;
import com.slidepilot.backend.chat.config.ChatProperties;
import com.slidepilot.backend.common.exception.ErrorCode;
import com.slidepilot.backend.common.exception.GenerationFailedException;
import com.slidepilot.backend.common.exception.NotFoundException;
import com.slidepilot.backend.conversation.ConversationService;
import com.slidepilot.backend.conversation.ConversationService.ConversationStart;
import com.slidepilot.backend.conversation.api.TurnEvent;
import com.slidepilot.backend.draft.DraftAssembler;
import com.slidepilot.backend.draft.FinalizationService;
import com.slidepilot.backend.draft.FinalizationService.FinalizedPresentation;
import com.slidepilot.backend.generation.model.GenerationResult;
import com.slidepilot.backend.session.SessionStore;
import com.slidepilot.backend.session.domain.PresentationDraft;
import com.slidepilot.backend.template.TemplateCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

@RestController
@RequestMapping("/api/v1/chat")
@Validated
@Slf4j
@Tag(name = "chat", description = "AI-guided presentation drafting")
public class ChatSessionController {

  private final ConversationService conversationService;
  private final DraftAssembler draftAssembler;
  private final FinalizationService finalizationService;
  private final SessionStore sessionStore;
  private final TemplateCatalog templateCatalog;
  private final ChatProperties chatProperties;

  public ChatSessionController(
      ConversationService conversationService,
      DraftAssembler draftAssembler,
      FinalizationService finalizationService,
      SessionStore sessionStore,
      TemplateCatalog templateCatalog,
      ChatProperties chatProperties) {
    this.conversationService = conversationService;
    this.draftAssembler = draftAssembler;
    this.finalizationService = finalizationService;
    this.sessionStore = sessionStore;
    this.templateCatalog = templateCatalog;
    this.chatProperties = chatProperties;
  }

  @GetMapping("/templates")
  @Operation(summary = "List templates that support guided mode")
  public List<GuidedTemplateResponse> templates() {
    return templateCatalog.guidedTemplates().stream().map(GuidedTemplateResponse::from).toList();
  }

  @PostMapping("/start")
  @Operation(summary = "Start guided chat session")
  public ChatStartResponse start(@RequestBody(required = false) ChatStartRequest request) {
    String template =
        request != null && StringUtils.hasText(request.template())
            ? request.template().trim()
            : templateCatalog.defaultTemplate();
    ConversationStart started = conversationService.start(template);
    return new ChatStartResponse(started.sessionId(), started.greeting());
  }

  @PostMapping(
      value = "/{sessionId}/message",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  @Operation(summary = "Send chat message and stream the assistant reply")
  public SseEmitter message(
      @PathVariable String sessionId, @RequestBody @Valid ChatMessageRequest request) {
    Flux<TurnEvent> events = conversationService.streamTurn(sessionId, request.message());

    SseEmitter emitter = new SseEmitter(chatProperties.getStreamTimeout().toMillis());
    AtomicReference<Disposable> subscriptionRef = new AtomicReference<>();

    Disposable subscription =
        events.subscribe(
            event -> emit(emitter, event),
            error -> handleError(sessionId, error, emitter),
            emitter::complete);
    subscriptionRef.set(subscription);

    emitter.onCompletion(() -> disposeSubscription(subscriptionRef));
    emitter.onError(error -> disposeSubscription(subscriptionRef));
    emitter.onTimeout(
        () -> {
          disposeSubscription(subscriptionRef);
          log.warn("Stream timeout reached for session {}", sessionId);
          emit(
              emitter,
              TurnEvent.error(
                  sessionId,
                  ErrorCode.BACKEND_UNAVAILABLE,
                  "Stream timeout reached, closing connection."));
          emitter.complete();
        });

    return emitter;
  }

  @PostMapping("/{sessionId}/draft")
  @Operation(summary = "Generate draft from conversation")
  public ChatDraftResponse draft(@PathVariable String sessionId) {
    GenerationResult<PresentationDraft> result = draftAssembler.assemble(sessionId);
    if (!result.isSuccess()) {
      throw new GenerationFailedException(result.failure());
    }
    return new ChatDraftResponse(sessionId, result.value());
  }

  @PostMapping("/{sessionId}/generate")
  @Operation(summary = "Generate final presentation from the draft")
  public GenerateResponse generate(@PathVariable String sessionId) {
    FinalizedPresentation finalized = finalizationService.finalizeDraft(sessionId);
    return new GenerateResponse(
        true,
        finalized.artifact().fileId(),
        finalized.artifact().downloadUrl(),
        finalized.preview());
  }

  @GetMapping("/{sessionId}")
  @Operation(summary = "Get session info")
  public ChatSessionInfo info(@PathVariable String sessionId) {
    return sessionStore
        .get(sessionId)
        .map(ChatSessionInfo::from)
        .orElseThrow(() -> NotFoundException.session(sessionId));
  }

  @DeleteMapping("/{sessionId}")
  @Operation(summary = "Delete session")
  public DeleteSessionResponse delete(@PathVariable String sessionId) {
    if (!sessionStore.delete(sessionId)) {
      throw NotFoundException.session(sessionId);
    }
    return new DeleteSessionResponse(true, "Session " + sessionId + " deleted");
  }

  private void emit(SseEmitter emitter, TurnEvent event) {
    try {
      emitter.send(SseEmitter.event().name(event.type()).data(event));
    } catch (IOException ioException) {
      log.warn(
          "Failed to send SSE event {} for session {}: {}",
          event.type(),
          event.sessionId(),
          ioException.getMessage());
      emitter.completeWithError(ioException);
    }
  }

  private void handleError(String sessionId, Throwable error, SseEmitter emitter) {
    log.error("Turn stream failed for session {}", sessionId, error);
    emit(
        emitter,
        TurnEvent.error(
            sessionId, ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.defaultMessage()));
    emitter.complete();
  }

  private void disposeSubscription(AtomicReference<Disposable> subscriptionRef) {
    Disposable disposable = subscriptionRef.getAndSet(null);
    if (disposable != null && !disposable.isDisposed()) {
      disposable.dispose();
    }
  }
}
