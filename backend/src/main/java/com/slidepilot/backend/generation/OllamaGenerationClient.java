package com.slidepilot.backend.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slidepilot.backend.generation.config.GenerationProperties;
import com.slidepilot.backend.generation.model.FailureKind;
import com.slidepilot.backend.generation.model.GenerationFailure;
import com.slidepilot.backend.generation.model.GenerationFragment;
import com.slidepilot.backend.generation.model.GenerationOptions;
import com.slidepilot.backend.generation.model.GenerationResult;
import com.slidepilot.backend.generation.model.GenerationUsage;
import com.slidepilot.backend.generation.model.PresentationPayload;
import com.slidepilot.backend.generation.model.StructuredRequest;
import com.slidepilot.backend.session.domain.PresentationDraft;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.retry.RetryContext;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;

/** {@link GenerationClient} for an Ollama-compatible {@code /api/generate} endpoint. */
public class OllamaGenerationClient implements GenerationClient {

  private static final Logger log = LoggerFactory.getLogger(OllamaGenerationClient.class);

  static final String GENERATE_PATH = "/api/generate";
  static final String TAGS_PATH = "/api/tags";

  private static final String MODE_STRUCTURED = "structured";
  private static final String MODE_STREAM = "stream";
  private static final String UNAVAILABLE_MESSAGE = "Generation backend is unavailable";
  private static final Duration AVAILABILITY_TIMEOUT = Duration.ofSeconds(5);

  private final WebClient webClient;
  private final RetryTemplate retryTemplate;
  private final ObjectMapper objectMapper;
  private final StructuredOutputParser parser;
  private final PresentationContentValidator validator;
  private final GenerationProperties properties;
  private final GenerationMetrics metrics;

  public OllamaGenerationClient(
      WebClient webClient,
      RetryTemplate retryTemplate,
      ObjectMapper objectMapper,
      StructuredOutputParser parser,
      PresentationContentValidator validator,
      GenerationProperties properties,
      GenerationMetrics metrics) {
    this.webClient = webClient;
    this.retryTemplate = retryTemplate;
    this.objectMapper = objectMapper;
    this.parser = parser;
    this.validator = validator;
    this.properties = properties;
    this.metrics = metrics;
  }

  @Override
  public GenerationResult<PresentationDraft> generateStructured(StructuredRequest request) {
    Map<String, Object> body = structuredBody(request);

    String envelope;
    try {
      envelope = retryTemplate.execute(context -> executeStructuredAttempt(body, context));
    } catch (WebClientException ex) {
      log.warn("Structured generation failed after retries: {}", ex.getMessage());
      return fail(GenerationFailure.unavailable(UNAVAILABLE_MESSAGE));
    }

    Optional<String> text = responseText(envelope);
    if (text.isEmpty()) {
      return fail(GenerationFailure.parse("Backend returned a malformed response envelope"));
    }

    GenerationResult<PresentationPayload> parsed = parser.parse(text.get());
    if (!parsed.isSuccess()) {
      return fail(parsed.failure());
    }
    GenerationResult<PresentationDraft> validated =
        validator.validate(parsed.value(), request.schema());
    if (!validated.isSuccess()) {
      return fail(validated.failure());
    }
    log.info(
        "Structured generation produced '{}' with {} slides",
        validated.value().title(),
        validated.value().slides().size());
    return validated;
  }

  @Override
  public Flux<GenerationFragment> stream(String prompt, String system, GenerationOptions options) {
    Map<String, Object> body = streamingBody(prompt, system, options);
    return Flux.defer(
            () -> {
              metrics.recordAttempt(MODE_STREAM);
              log.debug("Opening generation stream with model {}", properties.getModel());
              return webClient
                  .post()
                  .uri(GENERATE_PATH)
                  .contentType(MediaType.APPLICATION_JSON)
                  .accept(MediaType.APPLICATION_NDJSON, MediaType.APPLICATION_JSON)
                  .bodyValue(body)
                  .retrieve()
                  .bodyToFlux(String.class);
            })
        .filter(StringUtils::hasText)
        .<GenerationFragment>handle(
            (line, sink) -> parseStreamLine(line).ifPresent(sink::next))
        .doOnNext(fragment -> metrics.recordFragment())
        .doOnError(
            error -> {
              metrics.recordFailure(MODE_STREAM, FailureKind.UNAVAILABLE);
              log.warn("Generation stream failed: {}", error.getMessage());
            });
  }

  @Override
  public boolean isAvailable() {
    try {
      webClient.get().uri(TAGS_PATH).retrieve().toBodilessEntity().block(AVAILABILITY_TIMEOUT);
      return true;
    } catch (RuntimeException ex) {
      log.debug("Generation backend availability check failed: {}", ex.getMessage());
      return false;
    }
  }

  private String executeStructuredAttempt(Map<String, Object> body, RetryContext context) {
    int attempt = context.getRetryCount() + 1;
    metrics.recordAttempt(MODE_STRUCTURED);
    if (attempt > 1) {
      metrics.recordRetry(MODE_STRUCTURED);
      log.info("Retrying structured generation, attempt {}", attempt);
    }
    try {
      return webClient
          .post()
          .uri(GENERATE_PATH)
          .contentType(MediaType.APPLICATION_JSON)
          .accept(MediaType.APPLICATION_JSON)
          .bodyValue(body)
          .retrieve()
          .bodyToMono(String.class)
          .block();
    } catch (WebClientResponseException ex) {
      log.info(
          "Structured generation attempt {} got HTTP {}", attempt, ex.getStatusCode().value());
      throw ex;
    } catch (WebClientException ex) {
      log.info("Structured generation attempt {} failed: {}", attempt, ex.getMessage());
      throw ex;
    }
  }

  private Map<String, Object> structuredBody(StructuredRequest request) {
    Map<String, Object> options = new LinkedHashMap<>();
    options.put(
        "temperature",
        request.temperature() != null ? request.temperature() : properties.getDraftTemperature());
    options.put(
        "num_ctx",
        request.contextWindow() != null ? request.contextWindow() : properties.getContextWindow());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("model", properties.getModel());
    body.put("prompt", request.prompt());
    if (StringUtils.hasText(request.system())) {
      body.put("system", request.system());
    }
    body.put("stream", false);
    body.put("format", "json");
    body.put("options", options);
    return body;
  }

  private Map<String, Object> streamingBody(
      String prompt, String system, GenerationOptions options) {
    GenerationOptions effective = options != null ? options : GenerationOptions.empty();
    Map<String, Object> backendOptions = effective.toBackendOptions();
    backendOptions.putIfAbsent("temperature", properties.getTemperature());
    backendOptions.putIfAbsent("num_ctx", properties.getContextWindow());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("model", properties.getModel());
    body.put("prompt", prompt);
    if (StringUtils.hasText(system)) {
      body.put("system", system);
    }
    body.put("stream", true);
    if (effective.json()) {
      body.put("format", "json");
    }
    body.put("options", backendOptions);
    return body;
  }

  private Optional<String> responseText(String envelope) {
    if (!StringUtils.hasText(envelope)) {
      return Optional.empty();
    }
    try {
      JsonNode node = objectMapper.readTree(envelope);
      JsonNode response = node != null ? node.get("response") : null;
      if (response == null || !response.isTextual()) {
        return Optional.empty();
      }
      return Optional.of(response.asText());
    } catch (JsonProcessingException ex) {
      log.warn("Backend response envelope is not valid JSON: {}", ex.getOriginalMessage());
      return Optional.empty();
    }
  }

  Optional<GenerationFragment> parseStreamLine(String line) {
    JsonNode node;
    try {
      node = objectMapper.readTree(line);
    } catch (JsonProcessingException ex) {
      metrics.recordSkippedLine();
      log.debug("Skipping malformed stream line: {}", ex.getOriginalMessage());
      return Optional.empty();
    }
    if (node == null || !node.isObject()) {
      metrics.recordSkippedLine();
      return Optional.empty();
    }
    String text = node.path("response").asText("");
    boolean done = node.path("done").asBoolean(false);
    if (text.isEmpty() && !done) {
      return Optional.empty();
    }
    GenerationUsage usage = done ? usage(node) : null;
    return Optional.of(new GenerationFragment(text, done, usage));
  }

  private GenerationUsage usage(JsonNode node) {
    GenerationUsage usage =
        new GenerationUsage(
            node.hasNonNull("prompt_eval_count") ? node.get("prompt_eval_count").asInt() : null,
            node.hasNonNull("eval_count") ? node.get("eval_count").asInt() : null,
            node.hasNonNull("eval_duration") ? node.get("eval_duration").asLong() : null);
    return usage.hasAny() ? usage : null;
  }

  private <T> GenerationResult<T> fail(GenerationFailure failure) {
    metrics.recordFailure(MODE_STRUCTURED, failure.kind());
    return GenerationResult.failure(failure);
  }
}
