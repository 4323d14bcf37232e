package com.slidepilot.backend.support;

import com.slidepilot.backend.generation.GenerationClient;
import com.slidepilot.backend.generation.model.GenerationFailure;
import com.slidepilot.backend.generation.model.GenerationFragment;
import com.slidepilot.backend.generation.model.GenerationOptions;
import com.slidepilot.backend.generation.model.GenerationResult;
import com.slidepilot.backend.generation.model.StructuredRequest;
import com.slidepilot.backend.session.domain.PresentationDraft;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import reactor.core.publisher.Flux;

/** In-memory {@link GenerationClient} that replays scripted streams and structured results. */
public class ScriptedGenerationClient implements GenerationClient {

  private final Deque<Flux<GenerationFragment>> streams = new ArrayDeque<>();
  private final Deque<GenerationResult<PresentationDraft>> structuredResults = new ArrayDeque<>();
  private final List<String> streamPrompts = new ArrayList<>();
  private final List<String> streamSystems = new ArrayList<>();
  private final List<StructuredRequest> structuredRequests = new ArrayList<>();

  public synchronized void enqueueStream(String... fragments) {
    streams.add(
        Flux.fromArray(fragments)
            .map(GenerationFragment::of)
            .concatWith(Flux.just(new GenerationFragment("", true, null))));
  }

  public synchronized void enqueueStreamFailure(RuntimeException error, String... fragmentsBefore) {
    streams.add(
        Flux.fromArray(fragmentsBefore).map(GenerationFragment::of).concatWith(Flux.error(error)));
  }

  public synchronized void enqueueStream(Flux<GenerationFragment> stream) {
    streams.add(stream);
  }

  public synchronized void enqueueDraft(GenerationResult<PresentationDraft> result) {
    structuredResults.add(result);
  }

  public synchronized List<String> streamPrompts() {
    return List.copyOf(streamPrompts);
  }

  public synchronized List<String> streamSystems() {
    return List.copyOf(streamSystems);
  }

  public synchronized List<StructuredRequest> structuredRequests() {
    return List.copyOf(structuredRequests);
  }

  public synchronized void reset() {
    streams.clear();
    structuredResults.clear();
    streamPrompts.clear();
    streamSystems.clear();
    structuredRequests.clear();
  }

  @Override
  public synchronized GenerationResult<PresentationDraft> generateStructured(
      StructuredRequest request) {
    structuredRequests.add(request);
    GenerationResult<PresentationDraft> next = structuredResults.poll();
    return next != null
        ? next
        : GenerationResult.failure(GenerationFailure.unavailable("No scripted result"));
  }

  @Override
  public Flux<GenerationFragment> stream(String prompt, String system, GenerationOptions options) {
    return Flux.defer(
        () -> {
          Flux<GenerationFragment> next;
          synchronized (this) {
            streamPrompts.add(prompt);
            streamSystems.add(system);
            next = streams.poll();
          }
          return next != null
              ? next
              : Flux.error(new IllegalStateException("No scripted stream"));
        });
  }

  @Override
  public boolean isAvailable() {
    return true;
  }
}
