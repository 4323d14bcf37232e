package com.slidepilot.backend.session.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SlideDescriptor(
    SlideType type, String heading, String subheading, List<String> bullets) {

  public SlideDescriptor {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(heading, "heading");
    bullets = bullets != null ? List.copyOf(bullets) : null;
  }
}
