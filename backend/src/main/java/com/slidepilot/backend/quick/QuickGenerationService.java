package com.slidepilot.backend.quick;

import com.slidepilot.backend.common.exception.GenerationFailedException;
import com.slidepilot.backend.draft.FinalizationService;
import com.slidepilot.backend.draft.render.ArtifactReference;
import com.slidepilot.backend.generation.GenerationClient;
import com.slidepilot.backend.generation.config.GenerationProperties;
import com.slidepilot.backend.generation.model.GenerationResult;
import com.slidepilot.backend.generation.model.PresentationPayload;
import com.slidepilot.backend.generation.model.PresentationSchema;
import com.slidepilot.backend.generation.model.StructuredRequest;
import com.slidepilot.backend.quick.api.QuickGenerateRequest;
import com.slidepilot.backend.quick.config.QuickGenerationProperties;
import com.slidepilot.backend.session.domain.PresentationDraft;
import com.slidepilot.backend.template.TemplateCatalog;
import com.slidepilot.backend.template.TemplateDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Generates a presentation straight from a topic: one structured call for exactly the requested
 * number of slides, then the renderer. No session is created.
 */
@Service
public class QuickGenerationService {

  private static final Logger log = LoggerFactory.getLogger(QuickGenerationService.class);

  private final TemplateCatalog templateCatalog;
  private final GenerationClient generationClient;
  private final FinalizationService finalizationService;
  private final GenerationProperties generationProperties;
  private final QuickGenerationProperties quickProperties;
  private final BeanOutputConverter<PresentationPayload> outputConverter =
      new BeanOutputConverter<>(PresentationPayload.class);

  public QuickGenerationService(
      TemplateCatalog templateCatalog,
      GenerationClient generationClient,
      FinalizationService finalizationService,
      GenerationProperties generationProperties,
      QuickGenerationProperties quickProperties) {
    this.templateCatalog = templateCatalog;
    this.generationClient = generationClient;
    this.finalizationService = finalizationService;
    this.generationProperties = generationProperties;
    this.quickProperties = quickProperties;
  }

  /**
   * @throws com.slidepilot.backend.common.exception.NotFoundException if the template is unknown
   * @throws GenerationFailedException if the backend is unavailable or its output is rejected
   */
  public QuickPresentation generate(QuickGenerateRequest request) {
    TemplateDefinition template =
        templateCatalog.require(
            StringUtils.hasText(request.template())
                ? request.template().trim()
                : quickProperties.getDefaultTemplate());
    String language =
        StringUtils.hasText(request.language())
            ? request.language().trim()
            : quickProperties.getDefaultLanguage();
    int slides = effectiveSlides(request.slides());

    log.info(
        "Quick generation requested: topic='{}', language='{}', slides={}, template='{}'",
        request.topic(),
        language,
        slides,
        template.key());

    StructuredRequest structuredRequest =
        new StructuredRequest(
            buildPrompt(request.topic().trim(), language, slides),
            buildSystemPrompt(template),
            new PresentationSchema(slides, slides, true, slides > 1),
            request.temperature() != null
                ? request.temperature()
                : generationProperties.getDraftTemperature(),
            request.contextWindow());

    GenerationResult<PresentationDraft> result =
        generationClient.generateStructured(structuredRequest);
    if (!result.isSuccess()) {
      log.warn(
          "Quick generation failed for topic '{}': {} {}",
          request.topic(),
          result.failure().kind(),
          result.failure().message());
      throw new GenerationFailedException(result.failure());
    }

    PresentationDraft draft = result.value();
    ArtifactReference artifact = finalizationService.render(draft);
    log.info("Generated presentation {} with {} slides", artifact.fileId(), draft.slides().size());
    return new QuickPresentation(artifact, draft);
  }

  int effectiveSlides(Integer requested) {
    int slides = requested != null ? requested : quickProperties.getDefaultSlides();
    return Math.max(1, Math.min(slides, quickProperties.getMaxSlides()));
  }

  String buildPrompt(String topic, String language, int slides) {
    StringBuilder prompt = new StringBuilder();
    prompt
        .append("Generate a professional presentation outline in ")
        .append(language)
        .append(" about: \"")
        .append(topic)
        .append("\"\n\n")
        .append("The presentation must have exactly ")
        .append(slides)
        .append(slides == 1 ? " slide" : " slides")
        .append(":\n")
        .append("- Slide 1: title slide with the main topic and a subheading\n");
    if (slides > 2) {
      prompt.append("- Slides 2 to ").append(slides - 1).append(": content slides with key points\n");
    }
    if (slides > 1) {
      prompt.append("- Slide ").append(slides).append(": summary slide\n");
    }
    prompt
        .append('\n')
        .append("Focus on professional, concise content. Use clear headings and bullet points. ")
        .append("Output valid JSON only.");
    return prompt.toString();
  }

  String buildSystemPrompt(TemplateDefinition template) {
    StringBuilder system = new StringBuilder("Template: ").append(template.name()).append('\n');
    if (StringUtils.hasText(template.description())) {
      system.append(template.description()).append('\n');
    }
    return system.append('\n').append(outputConverter.getFormat()).toString();
  }

  public record QuickPresentation(ArtifactReference artifact, PresentationDraft preview) {}
}
