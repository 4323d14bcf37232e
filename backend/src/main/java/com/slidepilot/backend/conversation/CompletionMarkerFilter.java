package com.slidepilot.backend.conversation;

import org.springframework.util.Assert;

/**
 * Removes an in-band completion marker from streamed text while forwarding everything else as
 * early as possible.
 *
 * <p>Only the longest tail that could still grow into the marker is held back; the rest of each
 * fragment is released immediately and in arrival order. Matching is exact: a partial or
 * differently cased marker is ordinary text. Not thread-safe; one instance per stream.
 */
public class CompletionMarkerFilter {

  public static final String READY_FOR_DRAFT = "[READY_FOR_DRAFT]";

  private final String marker;
  private final StringBuilder pending = new StringBuilder();
  private boolean markerSeen;

  public CompletionMarkerFilter() {
    this(READY_FOR_DRAFT);
  }

  public CompletionMarkerFilter(String marker) {
    Assert.hasLength(marker, "marker must not be empty");
    this.marker = marker;
  }

  /** Accepts the next fragment and returns the text that is safe to forward, possibly empty. */
  public String accept(String fragment) {
    if (fragment == null || fragment.isEmpty()) {
      return "";
    }
    pending.append(fragment);
    if (removeMarkers(pending, marker)) {
      markerSeen = true;
    }
    int held = heldBackLength(pending, marker);
    int releasable = pending.length() - held;
    String released = pending.substring(0, releasable);
    pending.delete(0, releasable);
    return released;
  }

  /** Releases whatever is still held back. Called once the stream has completed. */
  public String flush() {
    String rest = pending.toString();
    pending.setLength(0);
    return rest;
  }

  public boolean isMarkerSeen() {
    return markerSeen;
  }

  /** Removes every occurrence of the marker, including ones formed by an earlier removal. */
  public static String strip(String text, String marker) {
    StringBuilder buffer = new StringBuilder(text);
    removeMarkers(buffer, marker);
    return buffer.toString();
  }

  private static boolean removeMarkers(StringBuilder buffer, String marker) {
    boolean removed = false;
    int index = buffer.indexOf(marker);
    while (index >= 0) {
      buffer.delete(index, index + marker.length());
      removed = true;
      index = buffer.indexOf(marker);
    }
    return removed;
  }

  // longest suffix of the buffer that is a proper prefix of the marker
  private static int heldBackLength(CharSequence buffer, String marker) {
    int max = Math.min(buffer.length(), marker.length() - 1);
    for (int length = max; length > 0; length--) {
      if (regionMatches(buffer, buffer.length() - length, marker, length)) {
        return length;
      }
    }
    return 0;
  }

  private static boolean regionMatches(CharSequence buffer, int offset, String marker, int length) {
    for (int i = 0; i < length; i++) {
      if (buffer.charAt(offset + i) != marker.charAt(i)) {
        return false;
      }
    }
    return true;
  }
}
