package com.slidepilot.backend.conversation;

import com.slidepilot.backend.session.domain.ChatMessage;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** Renders a transcript plus the new user message into the single prompt sent for a turn. */
@Component
public class TurnPromptBuilder {

  private static final String TURN_INSTRUCTIONS =
      """
      Respond naturally as the assistant. Remember to acknowledge what you understand, identify \
      missing information, and make helpful suggestions. Keep responses concise (max 2-3 \
      paragraphs).

      When you have gathered all necessary information, end your response with exactly this \
      phrase on its own line:
      """;

  public String buildTurnPrompt(List<ChatMessage> history, String userMessage) {
    return "Previous conversation:\n"
        + transcript(history)
        + "\n\nUser: "
        + userMessage
        + "\n\n"
        + TURN_INSTRUCTIONS
        + CompletionMarkerFilter.READY_FOR_DRAFT;
  }

  /** One {@code Speaker: content} line per message, in transcript order. */
  public String transcript(List<ChatMessage> history) {
    return history.stream()
        .map(message -> message.role().speakerLabel() + ": " + message.content())
        .collect(Collectors.joining("\n"));
  }
}
