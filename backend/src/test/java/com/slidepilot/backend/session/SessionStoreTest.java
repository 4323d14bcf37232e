package com.slidepilot.backend.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.slidepilot.backend.session.domain.ChatMessage;
import com.slidepilot.backend.session.domain.ChatRole;
import com.slidepilot.backend.session.domain.ConversationSession;
import com.slidepilot.backend.session.domain.SessionState;
import com.slidepilot.backend.session.domain.SlideDescriptor;
import com.slidepilot.backend.session.domain.SlideType;
import com.slidepilot.backend.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionStoreTest {

  private static final Duration TTL = Duration.ofHours(1);

  private MutableClock clock;
  private SessionStore store;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    store = new SessionStore(TTL, clock);
  }

  @Test
  void createReturnsEmptySessionWithFreshTimestamps() {
    ConversationSession session = store.create("general");

    assertThat(session.id()).isNotBlank();
    assertThat(session.template()).isEqualTo("general");
    assertThat(session.messages()).isEmpty();
    assertThat(session.readyForDraft()).isFalse();
    assertThat(session.draft()).isNull();
    assertThat(session.createdAt()).isEqualTo(clock.instant());
    assertThat(session.lastActivity()).isEqualTo(clock.instant());
    assertThat(session.state()).isEqualTo(SessionState.CREATED);
  }

  @Test
  void createAssignsDistinctIds() {
    Set<String> ids = new HashSet<>();
    for (int i = 0; i < 100; i++) {
      ids.add(store.create("general").id());
    }
    assertThat(ids).hasSize(100);
  }

  @Test
  void createRejectsBlankTemplate() {
    assertThatThrownBy(() -> store.create(" ")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsNonPositiveTtl() {
    assertThatThrownBy(() -> new SessionStore(Duration.ZERO, clock))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void getReturnsEmptyForUnknownId() {
    assertThat(store.get("missing")).isEmpty();
    assertThat(store.get(null)).isEmpty();
  }

  @Test
  void addMessageAppendsInOrderAndTouchesSession() {
    String id = store.create("general").id();

    clock.advance(Duration.ofMinutes(5));
    ChatMessage greeting = store.addMessage(id, ChatRole.ASSISTANT, "Hello!").orElseThrow();
    clock.advance(Duration.ofMinutes(1));
    store.addMessage(id, ChatRole.USER, "A deck about tides");

    ConversationSession session = store.get(id).orElseThrow();
    assertThat(greeting.timestamp()).isEqualTo(Instant.parse("2024-05-01T10:05:00Z"));
    assertThat(session.messages())
        .extracting(ChatMessage::role, ChatMessage::content)
        .containsExactly(
            tuple(ChatRole.ASSISTANT, "Hello!"),
            tuple(ChatRole.USER, "A deck about tides"));
    assertThat(session.lastActivity()).isEqualTo(Instant.parse("2024-05-01T10:06:00Z"));
    assertThat(session.state()).isEqualTo(SessionState.CONVERSING);
  }

  @Test
  void addMessageToUnknownSessionReturnsEmpty() {
    assertThat(store.addMessage("missing", ChatRole.USER, "hi")).isEmpty();
  }

  @Test
  void appendExchangeStoresBothMessagesTogether() {
    String id = store.create("general").id();
    store.addMessage(id, ChatRole.ASSISTANT, "Hello!");

    assertThat(store.appendExchange(id, "Topic is tides", "Great, who is the audience?")).isTrue();

    assertThat(store.get(id).orElseThrow().messages())
        .extracting(ChatMessage::role)
        .containsExactly(ChatRole.ASSISTANT, ChatRole.USER, ChatRole.ASSISTANT);
    assertThat(store.appendExchange("missing", "a", "b")).isFalse();
  }

  @Test
  void snapshotsDoNotChangeAfterLaterWrites() {
    String id = store.create("general").id();
    ConversationSession before = store.get(id).orElseThrow();

    store.addMessage(id, ChatRole.USER, "hello");
    store.setReady(id, true);

    assertThat(before.messages()).isEmpty();
    assertThat(before.readyForDraft()).isFalse();
    assertThatThrownBy(() -> before.messages().add(null))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void sessionExpiresWithoutSweep() {
    String id = store.create("general").id();

    clock.advance(TTL);
    assertThat(store.get(id)).isPresent();

    clock.advance(Duration.ofSeconds(1));
    assertThat(store.get(id)).isEmpty();
    assertThat(store.addMessage(id, ChatRole.USER, "late")).isEmpty();
    assertThat(store.setReady(id, true)).isFalse();
    assertThat(store.setDraft(id, "Title", List.of())).isFalse();
  }

  @Test
  void expiredSessionIsInvisibleToWritesBeforeAnyRead() {
    String id = store.create("general").id();
    clock.advance(TTL.plusSeconds(1));

    assertThat(store.appendExchange(id, "user", "assistant")).isFalse();
    assertThat(store.mergeExtractedInfo(id, Map.of("topic", "tides"))).isFalse();
  }

  @Test
  void activityExtendsLifetime() {
    String id = store.create("general").id();

    clock.advance(Duration.ofMinutes(50));
    store.addMessage(id, ChatRole.USER, "still here");
    clock.advance(Duration.ofMinutes(50));

    assertThat(store.get(id)).isPresent();
  }

  @Test
  void lastActivityNeverMovesBackwards() {
    String id = store.create("general").id();
    clock.advance(Duration.ofMinutes(10));
    store.addMessage(id, ChatRole.USER, "first");
    Instant touched = store.get(id).orElseThrow().lastActivity();

    clock.set(touched.minus(Duration.ofMinutes(5)));
    store.addMessage(id, ChatRole.USER, "second");

    assertThat(store.get(id).orElseThrow().lastActivity()).isEqualTo(touched);
  }

  @Test
  void setReadyIsIdempotent() {
    String id = store.create("general").id();

    assertThat(store.setReady(id, true)).isTrue();
    assertThat(store.setReady(id, true)).isTrue();

    ConversationSession session = store.get(id).orElseThrow();
    assertThat(session.readyForDraft()).isTrue();
    assertThat(session.state()).isEqualTo(SessionState.READY_FOR_DRAFT);
  }

  @Test
  void setDraftStoresSlidesAndLeavesReadyFlagAlone() {
    String id = store.create("general").id();
    List<SlideDescriptor> slides =
        List.of(
            new SlideDescriptor(SlideType.TITLE, "Tides", "How the moon moves water", null),
            new SlideDescriptor(SlideType.SUMMARY, "Wrap-up", null, List.of("Moon", "Sun")));

    assertThat(store.setDraft(id, "Tides 101", slides)).isTrue();

    ConversationSession session = store.get(id).orElseThrow();
    assertThat(session.draft().title()).isEqualTo("Tides 101");
    assertThat(session.draft().slides()).containsExactlyElementsOf(slides);
    assertThat(session.readyForDraft()).isFalse();
    assertThat(session.state()).isEqualTo(SessionState.DRAFT_AVAILABLE);
  }

  @Test
  void mergeExtractedInfoAddsAndOverwritesKeys() {
    String id = store.create("general").id();

    store.mergeExtractedInfo(id, Map.of("topic", "tides", "audience", "kids"));
    store.mergeExtractedInfo(id, Map.of("audience", "students"));

    assertThat(store.get(id).orElseThrow().extractedInfo())
        .containsEntry("topic", "tides")
        .containsEntry("audience", "students");
  }

  @Test
  void deleteRemovesSessionOnce() {
    String id = store.create("general").id();

    assertThat(store.delete(id)).isTrue();
    assertThat(store.delete(id)).isFalse();
    assertThat(store.get(id)).isEmpty();
  }

  @Test
  void sweepRemovesOnlyExpiredSessions() {
    String stale = store.create("general").id();
    clock.advance(Duration.ofMinutes(40));
    String fresh = store.create("general").id();
    clock.advance(Duration.ofMinutes(21));

    assertThat(store.sweepExpired()).isEqualTo(1);
    assertThat(store.get(stale)).isEmpty();
    assertThat(store.get(fresh)).isPresent();
  }

  @Test
  void activeCountSweepsFirst() {
    store.create("general");
    store.create("general");
    clock.advance(TTL.plusMinutes(1));
    store.create("general");

    assertThat(store.activeCount()).isEqualTo(1);
  }

  @Test
  void concurrentWritersDoNotLoseMessages() throws Exception {
    String id = store.create("general").id();
    int writers = 8;
    int messagesPerWriter = 50;
    ExecutorService executor = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int w = 0; w < writers; w++) {
        int writer = w;
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < messagesPerWriter; i++) {
                    store.appendExchange(id, "u" + writer + "-" + i, "a" + writer + "-" + i);
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    List<ChatMessage> messages = store.get(id).orElseThrow().messages();
    assertThat(messages).hasSize(writers * messagesPerWriter * 2);
    for (int i = 0; i < messages.size(); i += 2) {
      assertThat(messages.get(i).role()).isEqualTo(ChatRole.USER);
      assertThat(messages.get(i + 1).role()).isEqualTo(ChatRole.ASSISTANT);
      assertThat(messages.get(i + 1).content())
          .isEqualTo("a" + messages.get(i).content().substring(1));
    }
  }
}
