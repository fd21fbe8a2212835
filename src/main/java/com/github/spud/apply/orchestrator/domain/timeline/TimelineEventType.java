package com.github.spud.apply.orchestrator.domain.timeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Kind of fact recorded on a session timeline
 */
public enum TimelineEventType {
  THOUGHT("thought"),
  TOOL_CALL("tool_call"),
  SCREENSHOT("screenshot"),
  ERROR("error"),
  PAUSE("pause"),
  RESUME("resume");

  private final String wireName;

  TimelineEventType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String getWireName() {
    return wireName;
  }

  @JsonCreator
  public static TimelineEventType fromWireName(String value) {
    return Arrays.stream(values())
      .filter(t -> t.wireName.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
      .findFirst()
      .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + value));
  }
}
