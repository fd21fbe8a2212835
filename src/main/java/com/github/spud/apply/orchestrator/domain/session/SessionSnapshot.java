package com.github.spud.apply.orchestrator.domain.session;

import java.time.OffsetDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable view of a session at one point in time
 * Used for API responses and status-change notifications
 */
@Value
@Builder
public class SessionSnapshot {

  String sessionId;

  /**
   * Target job posting in the external job catalog
   */
  String jobReference;

  /**
   * Resume variant used for this attempt
   */
  String resumeReference;

  SessionStatus status;

  /**
   * Latest human-readable step, overwritten on every update
   */
  String currentStep;

  /**
   * Latest agent reasoning, overwritten on every update
   */
  String currentThought;

  /**
   * Location of the most recent screenshot, owned by the agent
   */
  String screenshotLocation;

  /**
   * Directory assigned to this session for screenshots
   */
  String screenshotDir;

  /**
   * Browser tab the agent is driving, owned by the agent
   */
  Integer tabIndex;

  /**
   * Set only when FAILED
   */
  String errorDetail;

  OffsetDateTime createdAt;

  OffsetDateTime updatedAt;

  /**
   * Set only when terminal
   */
  OffsetDateTime completedAt;

  public boolean isTerminal() {
    return status != null && status.isTerminal();
  }
}
