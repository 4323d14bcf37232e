package com.slidepilot.backend.chat.api;

import com.slidepilot.backend.session.domain.ConversationSession;
import com.slidepilot.backend.session.domain.SessionState;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;

@Schema(description = "Summary of a live conversation session.")
public record ChatSessionInfo(
    String sessionId,
    String template,
    int messageCount,
    @Schema(description = "Lifecycle state of the session.") SessionState state,
    boolean readyForDraft,
    boolean hasDraft,
    Instant createdAt,
    Instant lastActivity) {

  public static ChatSessionInfo from(ConversationSession session) {
    return new ChatSessionInfo(
        session.id(),
        session.template(),
        session.messages().size(),
        session.state(),
        session.readyForDraft(),
        session.draft() != null,
        session.createdAt(),
        session.lastActivity());
  }
}
