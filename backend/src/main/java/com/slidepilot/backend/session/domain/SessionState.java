package com.slidepilot.backend.session.domain;

/**
 * Observable lifecycle position of a live session. Expired sessions are never observed: every
 * store operation treats them as absent. Finalization happens outside the session engine.
 */
public enum SessionState {
  CREATED,
  CONVERSING,
  READY_FOR_DRAFT,
  DRAFT_AVAILABLE
}
