package com.github.spud.apply.orchestrator.domain.error;

public class SessionNotFoundException extends OrchestratorException {

  public SessionNotFoundException(String sessionId) {
    super(sessionId, "Session not found: " + sessionId);
  }

  @Override
  public String getCode() {
    return "SESSION_NOT_FOUND";
  }
}
