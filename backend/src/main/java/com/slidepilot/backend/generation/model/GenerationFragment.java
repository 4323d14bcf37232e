package com.slidepilot.backend.generation.model;

public record GenerationFragment(String text, boolean done, GenerationUsage usage) {

  public GenerationFragment {
    text = text != null ? text : "";
  }

  public static GenerationFragment of(String text) {
    return new GenerationFragment(text, false, null);
  }
}
