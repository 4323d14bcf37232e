package com.slidepilot.backend.conversation;

import static org.assertj.core.api.Assertions.assertThat;

import com.slidepilot.backend.session.domain.ChatMessage;
import com.slidepilot.backend.session.domain.ChatRole;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class TurnPromptBuilderTest {

  private final TurnPromptBuilder builder = new TurnPromptBuilder();

  @Test
  void promptContainsTranscriptNewMessageAndMarkerInstruction() {
    Instant now = Instant.parse("2024-05-01T10:00:00Z");
    List<ChatMessage> history =
        List.of(
            new ChatMessage(ChatRole.ASSISTANT, "Hello! What is your topic?", now),
            new ChatMessage(ChatRole.USER, "Ocean tides", now),
            new ChatMessage(ChatRole.ASSISTANT, "Who is the audience?", now));

    String prompt = builder.buildTurnPrompt(history, "Middle school students");

    assertThat(prompt)
        .startsWith(
            "Previous conversation:\n"
                + "Assistant: Hello! What is your topic?\n"
                + "User: Ocean tides\n"
                + "Assistant: Who is the audience?\n\n"
                + "User: Middle school students\n\n")
        .contains("Keep responses concise")
        .endsWith("phrase on its own line:\n[READY_FOR_DRAFT]");
  }

  @Test
  void emptyHistoryRendersEmptyTranscript() {
    assertThat(builder.transcript(List.of())).isEmpty();
  }
}
