package com.github.spud.apply.orchestrator.domain.error;

/**
 * Base type of every failure the orchestrator reports back to its caller.
 */
public abstract class OrchestratorException extends RuntimeException {

  private final String sessionId;

  protected OrchestratorException(String sessionId, String message) {
    super(message);
    this.sessionId = sessionId;
  }

  protected OrchestratorException(String sessionId, String message, Throwable cause) {
    super(message, cause);
    this.sessionId = sessionId;
  }

  public String getSessionId() {
    return sessionId;
  }

  /**
   * Stable error code exposed to API clients
   */
  public abstract String getCode();
}
