package com.slidepilot.backend.generation.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sampling parameters for a streaming call. Only non-null values are sent, under the backend's
 * option names.
 */
public record GenerationOptions(
    Double temperature,
    Integer topK,
    Double topP,
    Double minP,
    Double repeatPenalty,
    Integer repeatLastN,
    Integer contextWindow,
    Integer maxTokens,
    Integer seed,
    boolean json) {

  public static GenerationOptions empty() {
    return new GenerationOptions(null, null, null, null, null, null, null, null, null, false);
  }

  public static GenerationOptions withTemperature(Double temperature) {
    return new GenerationOptions(
        temperature, null, null, null, null, null, null, null, null, false);
  }

  public Map<String, Object> toBackendOptions() {
    Map<String, Object> options = new LinkedHashMap<>();
    putIfPresent(options, "temperature", temperature);
    putIfPresent(options, "num_ctx", contextWindow);
    putIfPresent(options, "num_predict", maxTokens);
    putIfPresent(options, "top_k", topK);
    putIfPresent(options, "top_p", topP);
    putIfPresent(options, "min_p", minP);
    putIfPresent(options, "repeat_penalty", repeatPenalty);
    putIfPresent(options, "repeat_last_n", repeatLastN);
    putIfPresent(options, "seed", seed);
    return options;
  }

  private static void putIfPresent(Map<String, Object> options, String key, Object value) {
    if (value != null) {
      options.put(key, value);
    }
  }
}
