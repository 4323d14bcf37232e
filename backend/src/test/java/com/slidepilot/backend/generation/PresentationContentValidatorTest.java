package com.slidepilot.backend.generation;

import static org.assertj.core.api.Assertions.assertThat;

import com.slidepilot.backend.generation.model.FailureKind;
import com.slidepilot.backend.generation.model.GenerationResult;
import com.slidepilot.backend.generation.model.PresentationPayload;
import com.slidepilot.backend.generation.model.PresentationPayload.SlidePayload;
import com.slidepilot.backend.generation.model.PresentationSchema;
import com.slidepilot.backend.session.domain.PresentationDraft;
import com.slidepilot.backend.session.domain.SlideType;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class PresentationContentValidatorTest {

  private static ValidatorFactory validatorFactory;
  private static PresentationContentValidator validator;

  @BeforeAll
  static void setUp() {
    validatorFactory = Validation.buildDefaultValidatorFactory();
    validator = new PresentationContentValidator(validatorFactory.getValidator());
  }

  @AfterAll
  static void tearDown() {
    validatorFactory.close();
  }

  @Test
  void validPayloadBecomesDraft() {
    PresentationPayload payload =
        new PresentationPayload(
            "Tides",
            List.of(
                slide("Title", "Tides", "Why the sea moves", null),
                slide("content", "The moon", null, List.of("Gravity", "Orbit")),
                slide(" summary ", "Wrap-up", null, List.of("Moon pulls water"))));

    GenerationResult<PresentationDraft> result = validator.validate(payload, PresentationSchema.DEFAULT);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.value().title()).isEqualTo("Tides");
    assertThat(result.value().slides())
        .extracting(slide -> slide.type())
        .containsExactly(SlideType.TITLE, SlideType.CONTENT, SlideType.SUMMARY);
    assertThat(result.value().slides().get(0).subheading()).isEqualTo("Why the sea moves");
  }

  @Test
  void fieldLimitsAreAllReported() {
    List<String> bullets = new ArrayList<>(Collections.nCopies(11, "point"));
    PresentationPayload payload =
        new PresentationPayload(
            "x".repeat(201),
            List.of(
                slide("title", "", "s".repeat(301), null),
                slide("content", "Heading", null, bullets)));

    GenerationResult<PresentationDraft> result = validator.validate(payload, PresentationSchema.DEFAULT);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.failure().kind()).isEqualTo(FailureKind.VALIDATION);
    assertThat(result.failure().violations())
        .anySatisfy(violation -> assertThat(violation).startsWith("title:"))
        .anySatisfy(violation -> assertThat(violation).startsWith("slides[0].heading:"))
        .anySatisfy(violation -> assertThat(violation).startsWith("slides[0].subheading:"))
        .anySatisfy(violation -> assertThat(violation).startsWith("slides[1].bullets:"));
  }

  @Test
  void unknownSlideTypeIsViolation() {
    PresentationPayload payload =
        new PresentationPayload("Deck", List.of(slide("agenda", "Agenda", null, null)));

    GenerationResult<PresentationDraft> result = validator.validate(payload, PresentationSchema.DEFAULT);

    assertThat(result.failure().violations())
        .containsExactly("slides[0].type: unknown slide type 'agenda'");
  }

  @Test
  void slideCountOutsideSchemaBoundsIsViolation() {
    PresentationPayload payload =
        new PresentationPayload(
            "Deck",
            List.of(
                slide("title", "Deck", null, null),
                slide("content", "One", null, null),
                slide("summary", "End", null, null)));

    GenerationResult<PresentationDraft> result = validator.validate(payload, PresentationSchema.draft());

    assertThat(result.failure().violations())
        .containsExactly("slides: expected between 5 and 7 slides but got 3");
  }

  @Test
  void emptySlideListIsViolation() {
    GenerationResult<PresentationDraft> result =
        validator.validate(new PresentationPayload("Deck", List.of()), PresentationSchema.DEFAULT);

    assertThat(result.failure().violations())
        .containsExactly("slides: expected between 1 and 20 slides but got 0");
  }

  @Test
  void draftSchemaRequiresTitleFirstAndSummaryLast() {
    PresentationPayload payload =
        new PresentationPayload(
            "Deck",
            List.of(
                slide("content", "A", null, null),
                slide("content", "B", null, null),
                slide("content", "C", null, null),
                slide("content", "D", null, null),
                slide("title", "E", null, null)));

    GenerationResult<PresentationDraft> result = validator.validate(payload, PresentationSchema.draft());

    assertThat(result.failure().violations())
        .containsExactlyInAnyOrder(
            "slides[0].type: first slide must be of type 'title'",
            "slides[4].type: last slide must be of type 'summary'");
  }

  private static SlidePayload slide(
      String type, String heading, String subheading, List<String> bullets) {
    return new SlidePayload(type, heading, subheading, bullets);
  }
}
