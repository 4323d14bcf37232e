package com.slidepilot.backend.generation;

import com.slidepilot.backend.generation.model.GenerationFragment;
import com.slidepilot.backend.generation.model.GenerationOptions;
import com.slidepilot.backend.generation.model.GenerationResult;
import com.slidepilot.backend.generation.model.StructuredRequest;
import com.slidepilot.backend.session.domain.PresentationDraft;
import reactor.core.publisher.Flux;

/** Client for the text generation backend. */
public interface GenerationClient {

  /**
   * Requests one complete presentation and returns it validated against the request's schema.
   * Transport failures are retried with backoff; parse and validation failures are returned as
   * they are.
   */
  GenerationResult<PresentationDraft> generateStructured(StructuredRequest request);

  /**
   * Streams a completion. Nothing is sent until the returned {@link Flux} is subscribed; it
   * completes after the backend's final fragment and errors on transport failure. A stream is
   * never retried, so resubscribing issues a brand-new request.
   *
   * @param system optional system instruction, may be null
   */
  Flux<GenerationFragment> stream(String prompt, String system, GenerationOptions options);

  boolean isAvailable();
}
