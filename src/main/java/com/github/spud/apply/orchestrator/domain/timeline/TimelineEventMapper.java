package com.github.spud.apply.orchestrator.domain.timeline;

import com.github.spud.apply.orchestrator.infrastructure.persistence.entity.SessionTimelineEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Mapper between timeline events and their persistence entities
 */
@Component
public class TimelineEventMapper {

  public SessionTimelineEvent toEntity(TimelineEvent event) {
    SessionTimelineEvent entity = new SessionTimelineEvent();
    entity.setSessionId(event.getSessionId());
    entity.setSeq(event.getSequence());
    entity.setEventType(event.getEventType());
    entity.setContent(event.getContent() != null ? event.getContent() : "");
    entity.setMetadata(event.getMetadata() != null ? new LinkedHashMap<>(event.getMetadata())
      : new LinkedHashMap<>());
    entity.setScreenshotLocation(event.getScreenshotLocation());
    entity.setOccurredAt(event.getTimestamp());
    return entity;
  }

  public TimelineEvent toDomain(SessionTimelineEvent entity) {
    return TimelineEvent.builder()
      .sessionId(entity.getSessionId())
      .sequence(entity.getSeq())
      .eventType(entity.getEventType())
      .timestamp(entity.getOccurredAt())
      .content(entity.getContent())
      .metadata(entity.getMetadata() != null
        ? Collections.unmodifiableMap(new LinkedHashMap<>(entity.getMetadata()))
        : Collections.emptyMap())
      .screenshotLocation(entity.getScreenshotLocation())
      .build();
  }

  public List<TimelineEvent> toDomainList(List<SessionTimelineEvent> entities) {
    List<TimelineEvent> events = new ArrayList<>(entities.size());
    for (SessionTimelineEvent entity : entities) {
      events.add(toDomain(entity));
    }
    return events;
  }
}
