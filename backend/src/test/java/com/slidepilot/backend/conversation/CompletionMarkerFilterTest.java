package com.slidepilot.backend.conversation;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CompletionMarkerFilterTest {

  @Test
  void textWithoutMarkerPassesThroughImmediately() {
    CompletionMarkerFilter filter = new CompletionMarkerFilter();

    assertThat(filter.accept("Hello ")).isEqualTo("Hello ");
    assertThat(filter.accept("there.")).isEqualTo("there.");
    assertThat(filter.flush()).isEmpty();
    assertThat(filter.isMarkerSeen()).isFalse();
  }

  @Test
  void markerInsideOneFragmentIsRemoved() {
    CompletionMarkerFilter filter = new CompletionMarkerFilter();

    String out = filter.accept("All set.\n[READY_FOR_DRAFT]");

    assertThat(out + filter.flush()).isEqualTo("All set.\n");
    assertThat(filter.isMarkerSeen()).isTrue();
  }

  @Test
  void markerSplitAcrossFragmentsNeverLeaks() {
    List<String> fragments = List.of("Great.\n[REA", "DY_FOR", "_DR", "AFT]", " Bye");

    List<String> forwarded = run(fragments);

    assertThat(String.join("", forwarded)).isEqualTo("Great.\n Bye");
    assertThat(forwarded).noneMatch(part -> part.contains("["));
  }

  @Test
  void markerSplitIntoSingleCharactersIsDetected() {
    String text = "Done [READY_FOR_DRAFT]";
    List<String> fragments = new ArrayList<>();
    for (char c : text.toCharArray()) {
      fragments.add(String.valueOf(c));
    }
    CompletionMarkerFilter filter = new CompletionMarkerFilter();
    StringBuilder out = new StringBuilder();
    fragments.forEach(fragment -> out.append(filter.accept(fragment)));
    out.append(filter.flush());

    assertThat(out.toString()).isEqualTo("Done ");
    assertThat(filter.isMarkerSeen()).isTrue();
  }

  @Test
  void onlyPossibleMarkerPrefixIsHeldBack() {
    CompletionMarkerFilter filter = new CompletionMarkerFilter();

    assertThat(filter.accept("See [1] and [READ")).isEqualTo("See [1] and ");
    assertThat(filter.accept("ME]")).isEqualTo("[README]");
    assertThat(filter.isMarkerSeen()).isFalse();
  }

  @Test
  void heldBackPrefixIsFlushedAtCompletion() {
    CompletionMarkerFilter filter = new CompletionMarkerFilter();

    assertThat(filter.accept("Almost [READY_FOR")).isEqualTo("Almost ");
    assertThat(filter.flush()).isEqualTo("[READY_FOR");
    assertThat(filter.isMarkerSeen()).isFalse();
  }

  @Test
  void matchingIsExactOnly() {
    CompletionMarkerFilter filter = new CompletionMarkerFilter();

    String out = filter.accept("[ready_for_draft] [READY FOR DRAFT]") + filter.flush();

    assertThat(out).isEqualTo("[ready_for_draft] [READY FOR DRAFT]");
    assertThat(filter.isMarkerSeen()).isFalse();
  }

  @Test
  void repeatedMarkersAreAllRemoved() {
    List<String> forwarded = run(List.of("[READY_FOR_DRAFT]a[READY_", "FOR_DRAFT]b[READY_FOR_DRAFT]"));

    assertThat(String.join("", forwarded)).isEqualTo("ab");
  }

  @Test
  void stripRemovesNestedOccurrences() {
    assertThat(CompletionMarkerFilter.strip("x[READY_[READY_FOR_DRAFT]FOR_DRAFT]y", "[READY_FOR_DRAFT]"))
        .isEqualTo("xy");
  }

  private List<String> run(List<String> fragments) {
    CompletionMarkerFilter filter = new CompletionMarkerFilter();
    List<String> forwarded = new ArrayList<>();
    for (String fragment : fragments) {
      String out = filter.accept(fragment);
      if (!out.isEmpty()) {
        forwarded.add(out);
      }
    }
    String tail = filter.flush();
    if (!tail.isEmpty()) {
      forwarded.add(tail);
    }
    return forwarded;
  }
}
