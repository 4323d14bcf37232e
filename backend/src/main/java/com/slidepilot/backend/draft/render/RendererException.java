package com.slidepilot.backend.draft.render;

import com.slidepilot.backend.common.exception.ErrorCode;
import com.slidepilot.backend.common.exception.SlidePilotException;

public class RendererException extends SlidePilotException {

  public RendererException(String message, Throwable cause) {
    super(ErrorCode.RENDERER_ERROR, message, cause);
  }
}
