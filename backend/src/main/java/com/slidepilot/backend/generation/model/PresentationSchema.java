package com.slidepilot.backend.generation.model;

/**
 * Shape constraints applied to a structured response on top of the per-field rules.
 *
 * @param minSlides inclusive lower bound on the slide count
 * @param maxSlides inclusive upper bound on the slide count
 * @param titleFirst whether the first slide must be of type {@code title}
 * @param summaryLast whether the last slide must be of type {@code summary}
 */
public record PresentationSchema(
    int minSlides, int maxSlides, boolean titleFirst, boolean summaryLast) {

  public static final PresentationSchema DEFAULT = new PresentationSchema(1, 20, false, false);

  public PresentationSchema {
    if (minSlides < 1 || maxSlides < minSlides) {
      throw new IllegalArgumentException(
          "Invalid slide bounds: " + minSlides + ".." + maxSlides);
    }
  }

  public static PresentationSchema draft() {
    return new PresentationSchema(5, 7, true, true);
  }
}
