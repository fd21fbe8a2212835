package com.github.spud.apply.orchestrator.domain.state;

import com.github.spud.apply.orchestrator.domain.session.SessionStatus;
import java.util.Optional;

/**
 * Session state machine events
 */
public enum SessionTrigger {
  /**
   * Agent picked the session up
   */
  START,

  /**
   * Operator or ingestion policy asked the agent to hold
   */
  PAUSE,

  /**
   * Operator released a paused session
   */
  RESUME,

  /**
   * Agent reported a submitted application
   */
  COMPLETE,

  /**
   * Unrecoverable error, cancel, or stale sweep
   */
  FAIL;

  /**
   * Event that would move a session from {@code from} to {@code to}, if any edge could.
   */
  public static Optional<SessionTrigger> between(SessionStatus from, SessionStatus to) {
    return switch (to) {
      case RUNNING -> Optional.of(from == SessionStatus.PAUSED ? RESUME : START);
      case PAUSED -> Optional.of(PAUSE);
      case COMPLETED -> Optional.of(COMPLETE);
      case FAILED -> Optional.of(FAIL);
      default -> Optional.empty();
    };
  }
}
