package com.slidepilot.backend.draft.render;

import com.slidepilot.backend.session.domain.PresentationDraft;

/** Turns an approved draft into a downloadable artifact. */
public interface PresentationRenderer {

  /**
   * @throws RendererException if the artifact cannot be produced
   */
  ArtifactReference render(PresentationDraft draft);
}
