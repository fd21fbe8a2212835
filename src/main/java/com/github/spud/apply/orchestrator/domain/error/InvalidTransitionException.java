package com.github.spud.apply.orchestrator.domain.error;

import com.github.spud.apply.orchestrator.domain.session.SessionStatus;
import lombok.Getter;

/**
 * The requested edge is not part of the session state machine.
 */
@Getter
public class InvalidTransitionException extends OrchestratorException {

  private final SessionStatus from;
  private final SessionStatus to;

  public InvalidTransitionException(String sessionId, SessionStatus from, SessionStatus to) {
    super(sessionId, String.format("Illegal transition %s -> %s for session %s", from, to,
      sessionId));
    this.from = from;
    this.to = to;
  }

  @Override
  public String getCode() {
    return "INVALID_TRANSITION";
  }
}
