package com.slidepilot.backend.draft;

import com.slidepilot.backend.common.exception.ErrorCode;
import com.slidepilot.backend.common.exception.InvalidStateException;
import com.slidepilot.backend.common.exception.NotFoundException;
import com.slidepilot.backend.draft.render.ArtifactReference;
import com.slidepilot.backend.draft.render.PresentationRenderer;
import com.slidepilot.backend.draft.render.RendererException;
import com.slidepilot.backend.session.SessionStore;
import com.slidepilot.backend.session.domain.ConversationSession;
import com.slidepilot.backend.session.domain.PresentationDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class FinalizationService {

  private static final Logger log = LoggerFactory.getLogger(FinalizationService.class);

  private final SessionStore sessionStore;
  private final PresentationRenderer renderer;

  public FinalizationService(SessionStore sessionStore, PresentationRenderer renderer) {
    this.sessionStore = sessionStore;
    this.renderer = renderer;
  }

  /** Hands the session's current draft to the renderer. The session itself is not modified. */
  public FinalizedPresentation finalizeDraft(String sessionId) {
    ConversationSession session =
        sessionStore.get(sessionId).orElseThrow(() -> NotFoundException.session(sessionId));
    PresentationDraft draft =
        session
            .findDraft()
            .orElseThrow(() -> new InvalidStateException(ErrorCode.NO_DRAFT));

    ArtifactReference artifact = render(draft);
    log.info("Generated presentation {} from draft for session {}", artifact.fileId(), sessionId);
    return new FinalizedPresentation(sessionId, artifact, draft);
  }

  /**
   * Hands a draft straight to the renderer. Renderer failures other than {@link
   * RendererException} are wrapped into one.
   */
  public ArtifactReference render(PresentationDraft draft) {
    try {
      return renderer.render(draft);
    } catch (RendererException ex) {
      log.error("Renderer failed for presentation '{}'", draft.title(), ex);
      throw ex;
    } catch (RuntimeException ex) {
      log.error("Renderer failed for presentation '{}'", draft.title(), ex);
      throw new RendererException("Failed to render the presentation.", ex);
    }
  }

  public record FinalizedPresentation(
      String sessionId, ArtifactReference artifact, PresentationDraft preview) {}
}
