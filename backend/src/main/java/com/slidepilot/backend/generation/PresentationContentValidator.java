package com.slidepilot.backend.generation;

import com.slidepilot.backend.generation.model.GenerationFailure;
import com.slidepilot.backend.generation.model.GenerationResult;
import com.slidepilot.backend.generation.model.PresentationPayload;
import com.slidepilot.backend.generation.model.PresentationPayload.SlidePayload;
import com.slidepilot.backend.generation.model.PresentationSchema;
import com.slidepilot.backend.session.domain.PresentationDraft;
import com.slidepilot.backend.session.domain.SlideDescriptor;
import com.slidepilot.backend.session.domain.SlideType;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a parsed presentation against field rules (lengths, bullet counts, required values) and
 * the request's {@link PresentationSchema}. Every violation is reported, not just the first.
 */
public class PresentationContentValidator {

  private static final Logger log = LoggerFactory.getLogger(PresentationContentValidator.class);

  private final Validator validator;

  public PresentationContentValidator(Validator validator) {
    this.validator = validator;
  }

  public GenerationResult<PresentationDraft> validate(
      PresentationPayload payload, PresentationSchema schema) {
    List<String> violations = new ArrayList<>();

    validator.validate(payload).stream()
        .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
        .map(this::describe)
        .forEach(violations::add);

    List<SlidePayload> slides = payload.slides() != null ? payload.slides() : List.of();
    List<SlideType> types = new ArrayList<>(slides.size());
    for (int i = 0; i < slides.size(); i++) {
      SlidePayload slide = slides.get(i);
      if (slide == null) {
        types.add(null);
        continue;
      }
      Optional<SlideType> type = SlideType.find(slide.type());
      if (type.isEmpty() && slide.type() != null && !slide.type().isBlank()) {
        violations.add("slides[" + i + "].type: unknown slide type '" + slide.type() + "'");
      }
      types.add(type.orElse(null));
    }

    if (slides.size() < schema.minSlides() || slides.size() > schema.maxSlides()) {
      violations.add(
          "slides: expected between %d and %d slides but got %d"
              .formatted(schema.minSlides(), schema.maxSlides(), slides.size()));
    }
    if (schema.titleFirst() && !types.isEmpty() && types.get(0) != SlideType.TITLE) {
      violations.add("slides[0].type: first slide must be of type 'title'");
    }
    if (schema.summaryLast()
        && !types.isEmpty()
        && types.get(types.size() - 1) != SlideType.SUMMARY) {
      violations.add("slides[" + (types.size() - 1) + "].type: last slide must be of type 'summary'");
    }

    if (!violations.isEmpty()) {
      log.warn("Presentation content failed validation: {}", violations);
      return GenerationResult.failure(GenerationFailure.validation(violations));
    }

    List<SlideDescriptor> descriptors = new ArrayList<>(slides.size());
    for (int i = 0; i < slides.size(); i++) {
      SlidePayload slide = slides.get(i);
      descriptors.add(
          new SlideDescriptor(types.get(i), slide.heading(), slide.subheading(), slide.bullets()));
    }
    return GenerationResult.success(new PresentationDraft(payload.title(), descriptors));
  }

  private String describe(ConstraintViolation<PresentationPayload> violation) {
    return violation.getPropertyPath() + ": " + violation.getMessage();
  }
}
