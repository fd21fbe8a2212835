package com.github.spud.apply.orchestrator.domain.error;

public class DuplicateSessionException extends OrchestratorException {

  public DuplicateSessionException(String sessionId) {
    super(sessionId, "Session already exists: " + sessionId);
  }

  @Override
  public String getCode() {
    return "DUPLICATE_SESSION";
  }
}
