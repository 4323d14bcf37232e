package com.slidepilot.backend.conversation.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.slidepilot.backend.common.exception.ErrorCode;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * One event of a streamed turn: any number of {@code token} events followed by exactly one
 * terminal {@code complete} or {@code error} event.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Event emitted while a conversation turn is streamed")
public record TurnEvent(
    @Schema(description = "Session the turn belongs to") String sessionId,
    @Schema(description = "token, complete or error") String type,
    @Schema(description = "Visible text for token, full reply for complete, message for error")
        String content,
    @Schema(description = "True on the terminal event") boolean done,
    @Schema(description = "Whether the assistant signalled it has enough information; only set when done")
        boolean readyForDraft,
    @Schema(description = "Error code on error events") String code) {

  public static final String TOKEN = "token";
  public static final String COMPLETE = "complete";
  public static final String ERROR = "error";

  public static TurnEvent token(String sessionId, String content) {
    return new TurnEvent(sessionId, TOKEN, content, false, false, null);
  }

  public static TurnEvent complete(String sessionId, String content, boolean readyForDraft) {
    return new TurnEvent(sessionId, COMPLETE, content, true, readyForDraft, null);
  }

  public static TurnEvent error(String sessionId, ErrorCode code, String message) {
    return new TurnEvent(sessionId, ERROR, message, true, false, code.name());
  }
}
