package com.github.spud.apply.orchestrator.domain.session;

/**
 * Session lifecycle status
 * <pre>
 * QUEUED → RUNNING ⇄ PAUSED
 * RUNNING → COMPLETED
 * QUEUED | RUNNING | PAUSED → FAILED
 * </pre>
 */
public enum SessionStatus {
  /**
   * Created, agent not started yet
   */
  QUEUED,

  /**
   * Agent is issuing automation actions
   */
  RUNNING,

  /**
   * Agent was asked to stop at its next safe point and wait for an operator
   */
  PAUSED,

  /**
   * Application submitted (terminal)
   */
  COMPLETED,

  /**
   * Gave up, see error detail (terminal)
   */
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
