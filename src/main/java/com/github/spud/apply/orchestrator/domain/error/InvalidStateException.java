package com.github.spud.apply.orchestrator.domain.error;

import com.github.spud.apply.orchestrator.domain.session.SessionStatus;
import lombok.Getter;

/**
 * The operation is not allowed while the session is in its current status.
 */
@Getter
public class InvalidStateException extends OrchestratorException {

  private final SessionStatus actual;

  public InvalidStateException(String sessionId, SessionStatus actual, String message) {
    super(sessionId, message);
    this.actual = actual;
  }

  @Override
  public String getCode() {
    return "INVALID_STATE";
  }
}
