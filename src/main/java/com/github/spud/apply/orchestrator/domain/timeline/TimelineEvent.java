package com.github.spud.apply.orchestrator.domain.timeline;

import java.time.OffsetDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One immutable, ordered fact about a session's progress
 */
@Value
@Builder
public class TimelineEvent {

  String sessionId;

  /**
   * Position in the session timeline, starting at 1 with no gaps
   */
  long sequence;

  TimelineEventType eventType;

  /**
   * Assigned at append time, never earlier than the previous event of the same session
   */
  OffsetDateTime timestamp;

  String content;

  Map<String, Object> metadata;

  /**
   * Only set on screenshot events
   */
  String screenshotLocation;
}
