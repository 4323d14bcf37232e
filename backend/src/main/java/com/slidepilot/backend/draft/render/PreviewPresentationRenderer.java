package com.slidepilot.backend.draft.render;

import com.slidepilot.backend.session.domain.PresentationDraft;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default renderer used when no file renderer is wired in. It only allocates the artifact id and
 * download location; the draft itself is returned to the caller as the preview.
 */
public class PreviewPresentationRenderer implements PresentationRenderer {

  private static final Logger log = LoggerFactory.getLogger(PreviewPresentationRenderer.class);

  static final String DOWNLOAD_PATH = "/api/v1/download/";

  @Override
  public ArtifactReference render(PresentationDraft draft) {
    String fileId = UUID.randomUUID().toString();
    log.info("Allocated artifact {} for presentation '{}'", fileId, draft.title());
    return new ArtifactReference(fileId, DOWNLOAD_PATH + fileId);
  }
}
