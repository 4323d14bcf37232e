package com.slidepilot.backend.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slidepilot.backend.generation.model.GenerationFailure;
import com.slidepilot.backend.generation.model.GenerationResult;
import com.slidepilot.backend.generation.model.PresentationPayload;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls a presentation JSON object out of free model text. The model may wrap the object in prose
 * or Markdown fences, so the slice from the first {@code '{'} to the last {@code '}'} is taken as
 * the candidate payload.
 */
public class StructuredOutputParser {

  private static final Logger log = LoggerFactory.getLogger(StructuredOutputParser.class);

  private final ObjectMapper objectMapper;

  public StructuredOutputParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public Optional<String> extractJsonObject(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    int start = raw.indexOf('{');
    int end = raw.lastIndexOf('}');
    if (start < 0 || end <= start) {
      return Optional.empty();
    }
    return Optional.of(raw.substring(start, end + 1));
  }

  public GenerationResult<PresentationPayload> parse(String raw) {
    Optional<String> candidate = extractJsonObject(raw);
    if (candidate.isEmpty()) {
      log.warn("Model response contains no JSON object ({} chars)", raw != null ? raw.length() : 0);
      return GenerationResult.failure(
          GenerationFailure.parse("Model response does not contain a JSON object"));
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(candidate.get());
    } catch (JsonProcessingException ex) {
      log.warn("Failed to parse JSON from model response: {}", ex.getOriginalMessage());
      return GenerationResult.failure(GenerationFailure.parse("Invalid JSON in model response"));
    }

    if (root == null || !root.isObject()) {
      return GenerationResult.failure(GenerationFailure.parse("Response is not a JSON object"));
    }
    if (!hasValue(root, "title") || !hasValue(root, "slides")) {
      return GenerationResult.failure(
          GenerationFailure.parse("Missing required fields: title, slides"));
    }
    if (!root.get("slides").isArray()) {
      return GenerationResult.failure(GenerationFailure.parse("Field 'slides' is not an array"));
    }

    try {
      return GenerationResult.success(objectMapper.treeToValue(root, PresentationPayload.class));
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      log.warn("Model response has an unexpected structure: {}", ex.getMessage());
      return GenerationResult.failure(
          GenerationFailure.parse("Model response has an unexpected structure"));
    }
  }

  private boolean hasValue(JsonNode root, String field) {
    JsonNode node = root.get(field);
    return node != null && !node.isNull();
  }
}
