package com.github.spud.apply.orchestrator.domain.timeline;

import lombok.Value;

/**
 * Published synchronously by {@link TimelineStore} after an event is durable, in sequence order
 * per session.
 */
@Value
public class TimelineAppendedEvent {

  TimelineEvent event;
}
