package com.slidepilot.backend.session.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of a conversation session. The store keeps the mutable record and hands out
 * a fresh snapshot after every read or write.
 */
public record ConversationSession(
    String id,
    String template,
    List<ChatMessage> messages,
    Map<String, Object> extractedInfo,
    PresentationDraft draft,
    boolean readyForDraft,
    Instant createdAt,
    Instant lastActivity) {

  public ConversationSession {
    messages = List.copyOf(messages);
    extractedInfo = Collections.unmodifiableMap(new LinkedHashMap<>(extractedInfo));
  }

  public Optional<PresentationDraft> findDraft() {
    return Optional.ofNullable(draft);
  }

  public SessionState state() {
    if (draft != null) {
      return SessionState.DRAFT_AVAILABLE;
    }
    if (readyForDraft) {
      return SessionState.READY_FOR_DRAFT;
    }
    return messages.isEmpty() ? SessionState.CREATED : SessionState.CONVERSING;
  }
}
