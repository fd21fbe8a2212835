package com.github.spud.apply.orchestrator.domain.gateway;

import com.github.spud.apply.orchestrator.domain.timeline.TimelineEventType;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Event reported by an agent, before it is given a sequence and timestamp
 */
@Value
@Builder
public class IngestedEvent {

  TimelineEventType eventType;

  String content;

  Map<String, Object> metadata;

  String screenshotLocation;
}
