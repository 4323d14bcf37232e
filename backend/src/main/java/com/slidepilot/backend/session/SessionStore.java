package com.slidepilot.backend.session;

import com.slidepilot.backend.session.domain.ChatMessage;
import com.slidepilot.backend.session.domain.ChatRole;
import com.slidepilot.backend.session.domain.ConversationSession;
import com.slidepilot.backend.session.domain.PresentationDraft;
import com.slidepilot.backend.session.domain.SlideDescriptor;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * In-memory store of guided conversation sessions.
 *
 * <p>Every operation runs inside a single monitor covering the whole map, so mutations are atomic
 * relative to each other. Callers receive immutable {@link ConversationSession} snapshots.
 *
 * <p>Expiry is evaluated against {@code lastActivity + ttl} on every access: an expired record is
 * never returned or mutated, and is removed the moment it is touched. Bulk removal only happens in
 * {@link #sweepExpired()}, which {@link #create(String)} and {@link #activeCount()} invoke before
 * doing their own work; there is no background timer.
 */
public class SessionStore {

  private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

  private final Map<String, SessionRecord> sessions = new HashMap<>();
  private final Object monitor = new Object();
  private final Duration ttl;
  private final Clock clock;

  public SessionStore(Duration ttl, Clock clock) {
    Assert.notNull(ttl, "ttl must not be null");
    Assert.isTrue(!ttl.isNegative() && !ttl.isZero(), "ttl must be positive");
    this.ttl = ttl;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public ConversationSession create(String template) {
    Assert.hasText(template, "template must not be blank");
    synchronized (monitor) {
      sweepExpired();
      String id = nextId();
      SessionRecord record = new SessionRecord(id, template, now());
      sessions.put(id, record);
      log.info("Created session {} for template '{}'", id, template);
      return record.snapshot();
    }
  }

  public Optional<ConversationSession> get(String sessionId) {
    synchronized (monitor) {
      return live(sessionId).map(SessionRecord::snapshot);
    }
  }

  public Optional<ChatMessage> addMessage(String sessionId, ChatRole role, String content) {
    Assert.notNull(role, "role must not be null");
    Assert.notNull(content, "content must not be null");
    synchronized (monitor) {
      Optional<SessionRecord> record = live(sessionId);
      if (record.isEmpty()) {
        return Optional.empty();
      }
      ChatMessage message = record.get().append(role, content, now());
      log.debug("Added {} message to session {}", role.value(), sessionId);
      return Optional.of(message);
    }
  }

  /**
   * Appends a user message and the assistant reply to it in one step, so no other operation can
   * observe the transcript with only half of the exchange.
   */
  public boolean appendExchange(String sessionId, String userContent, String assistantContent) {
    Assert.notNull(userContent, "userContent must not be null");
    Assert.notNull(assistantContent, "assistantContent must not be null");
    synchronized (monitor) {
      Optional<SessionRecord> record = live(sessionId);
      if (record.isEmpty()) {
        return false;
      }
      Instant timestamp = now();
      record.get().append(ChatRole.USER, userContent, timestamp);
      record.get().append(ChatRole.ASSISTANT, assistantContent, timestamp);
      log.debug("Committed exchange to session {}", sessionId);
      return true;
    }
  }

  public boolean mergeExtractedInfo(String sessionId, Map<String, ?> info) {
    Assert.notNull(info, "info must not be null");
    synchronized (monitor) {
      Optional<SessionRecord> record = live(sessionId);
      if (record.isEmpty()) {
        return false;
      }
      record.get().extractedInfo.putAll(info);
      record.get().touch(now());
      log.debug("Updated extracted info for session {}", sessionId);
      return true;
    }
  }

  public boolean setReady(String sessionId, boolean ready) {
    synchronized (monitor) {
      Optional<SessionRecord> record = live(sessionId);
      if (record.isEmpty()) {
        return false;
      }
      record.get().readyForDraft = ready;
      record.get().touch(now());
      return true;
    }
  }

  public boolean setDraft(String sessionId, String title, List<SlideDescriptor> slides) {
    Assert.notNull(title, "title must not be null");
    Assert.notNull(slides, "slides must not be null");
    synchronized (monitor) {
      Optional<SessionRecord> record = live(sessionId);
      if (record.isEmpty()) {
        return false;
      }
      record.get().draft = new PresentationDraft(title, slides);
      record.get().touch(now());
      log.info("Set draft for session {}: {} slides", sessionId, slides.size());
      return true;
    }
  }

  public boolean delete(String sessionId) {
    synchronized (monitor) {
      if (sessionId != null && sessions.remove(sessionId) != null) {
        log.info("Deleted session {}", sessionId);
        return true;
      }
      return false;
    }
  }

  public int activeCount() {
    synchronized (monitor) {
      sweepExpired();
      return sessions.size();
    }
  }

  /**
   * Removes every expired session and returns how many were dropped. This is the only bulk
   * cleanup path; it is triggered by {@link #create(String)} and {@link #activeCount()}.
   */
  public int sweepExpired() {
    synchronized (monitor) {
      Instant now = now();
      int removed = 0;
      Iterator<SessionRecord> iterator = sessions.values().iterator();
      while (iterator.hasNext()) {
        if (iterator.next().isExpired(now, ttl)) {
          iterator.remove();
          removed++;
        }
      }
      if (removed > 0) {
        log.info("Cleaned up {} expired sessions", removed);
      }
      return removed;
    }
  }

  public Duration getTtl() {
    return ttl;
  }

  private Optional<SessionRecord> live(String sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    SessionRecord record = sessions.get(sessionId);
    if (record == null) {
      log.debug("Session {} not found", sessionId);
      return Optional.empty();
    }
    if (record.isExpired(now(), ttl)) {
      sessions.remove(sessionId);
      log.info("Session {} has expired, removing", sessionId);
      return Optional.empty();
    }
    return Optional.of(record);
  }

  private String nextId() {
    String id = UUID.randomUUID().toString();
    while (sessions.containsKey(id)) {
      id = UUID.randomUUID().toString();
    }
    return id;
  }

  private Instant now() {
    return clock.instant();
  }

  private static final class SessionRecord {

    private final String id;
    private final String template;
    private final List<ChatMessage> messages = new ArrayList<>();
    private final Map<String, Object> extractedInfo = new LinkedHashMap<>();
    private final Instant createdAt;
    private PresentationDraft draft;
    private boolean readyForDraft;
    private Instant lastActivity;

    private SessionRecord(String id, String template, Instant createdAt) {
      this.id = id;
      this.template = template;
      this.createdAt = createdAt;
      this.lastActivity = createdAt;
    }

    private ChatMessage append(ChatRole role, String content, Instant timestamp) {
      ChatMessage message = new ChatMessage(role, content, timestamp);
      messages.add(message);
      touch(timestamp);
      return message;
    }

    // lastActivity never moves backwards, even if the clock does
    private void touch(Instant timestamp) {
      if (timestamp.isAfter(lastActivity)) {
        lastActivity = timestamp;
      }
    }

    private boolean isExpired(Instant now, Duration ttl) {
      return now.isAfter(lastActivity.plus(ttl));
    }

    private ConversationSession snapshot() {
      return new ConversationSession(
          id, template, messages, extractedInfo, draft, readyForDraft, createdAt, lastActivity);
    }
  }
}
