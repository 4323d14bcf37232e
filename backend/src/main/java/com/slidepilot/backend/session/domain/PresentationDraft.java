package com.slidepilot.backend.session.domain;

import java.util.List;
import java.util.Objects;

public record PresentationDraft(String title, List<SlideDescriptor> slides) {

  public PresentationDraft {
    Objects.requireNonNull(title, "title");
    slides = slides != null ? List.copyOf(slides) : List.of();
  }
}
