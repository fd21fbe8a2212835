package com.github.spud.apply.orchestrator.domain.timeline;

import com.github.spud.apply.orchestrator.application.config.OrchestratorProperties;
import com.github.spud.apply.orchestrator.domain.error.SessionNotFoundException;
import com.github.spud.apply.orchestrator.domain.session.SessionRegistry;
import com.github.spud.apply.orchestrator.domain.session.SessionStatusChangedEvent;
import com.github.spud.apply.orchestrator.infrastructure.persistence.repository.SessionTimelineEventRepository;
import com.github.spud.apply.orchestrator.util.StripedLock;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Append-only, durable log of timeline events per session.
 * <p>
 * Appends for one session are serialised: sequence assignment, the database write and the
 * {@link TimelineAppendedEvent} notification happen under the session's lock, so listeners see
 * events in sequence order. Appends for different sessions only share a lock when their ids hash
 * onto the same stripe.
 */
@Slf4j
@Service
public class TimelineStore {

  private final SessionTimelineEventRepository repository;
  private final SessionRegistry sessionRegistry;
  private final TimelineEventMapper mapper;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  private final StripedLock locks;
  private final Map<String, Cursor> cursors = new ConcurrentHashMap<>();

  public TimelineStore(SessionTimelineEventRepository repository, SessionRegistry sessionRegistry,
    TimelineEventMapper mapper, ApplicationEventPublisher eventPublisher,
    OrchestratorProperties properties, Clock clock) {
    this.repository = repository;
    this.sessionRegistry = sessionRegistry;
    this.mapper = mapper;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
    this.locks = new StripedLock(properties.getRegistry().getShards());
  }

  public TimelineEvent append(String sessionId, TimelineEventType eventType, String content) {
    return append(sessionId, eventType, content, null, null);
  }

  /**
   * Durably append an event and notify live subscribers
   *
   * @throws SessionNotFoundException unknown session
   * @throws IllegalArgumentException screenshot location missing on a screenshot event, or
   *                                  present on any other type
   */
  public TimelineEvent append(String sessionId, TimelineEventType eventType, String content,
    Map<String, Object> metadata, String screenshotLocation) {
    if (eventType == null) {
      throw new IllegalArgumentException("eventType is required");
    }
    boolean screenshot = eventType == TimelineEventType.SCREENSHOT;
    if (screenshot && !StringUtils.hasText(screenshotLocation)) {
      throw new IllegalArgumentException("screenshot events require a screenshot location");
    }
    if (!screenshot && StringUtils.hasText(screenshotLocation)) {
      throw new IllegalArgumentException(
        "screenshot location is only allowed on screenshot events, got " + eventType);
    }
    if (!sessionRegistry.exists(sessionId)) {
      throw new SessionNotFoundException(sessionId);
    }

    TimelineEvent appended = locks.withLock(sessionId, () -> {
      Cursor cursor = cursors.computeIfAbsent(sessionId, this::loadCursor);

      OffsetDateTime timestamp = OffsetDateTime.now(clock);
      if (cursor.lastTimestamp != null && timestamp.isBefore(cursor.lastTimestamp)) {
        timestamp = cursor.lastTimestamp;
      }

      TimelineEvent event = TimelineEvent.builder()
        .sessionId(sessionId)
        .sequence(cursor.lastSequence + 1)
        .eventType(eventType)
        .timestamp(timestamp)
        .content(content != null ? content : "")
        .metadata(metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
          : Collections.emptyMap())
        .screenshotLocation(screenshotLocation)
        .build();

      repository.save(mapper.toEntity(event));
      cursor.lastSequence = event.getSequence();
      cursor.lastTimestamp = timestamp;

      notifyAppended(event);
      return event;
    });

    log.debug("Appended timeline event: sessionId={}, seq={}, type={}", sessionId,
      appended.getSequence(), eventType);
    return appended;
  }

  /**
   * Events after {@code sinceSequence} in sequence order; pass null or 0 for full replay
   *
   * @throws SessionNotFoundException unknown session
   */
  public List<TimelineEvent> list(String sessionId, Long sinceSequence) {
    if (!sessionRegistry.exists(sessionId)) {
      throw new SessionNotFoundException(sessionId);
    }
    long since = sinceSequence == null ? 0L : Math.max(0L, sinceSequence);
    return mapper.toDomainList(repository.listEvents(sessionId, since));
  }

  public List<TimelineEvent> list(String sessionId) {
    return list(sessionId, null);
  }

  /**
   * Drop the cached cursor of a finished session; later appends reload it from the database.
   */
  @EventListener
  public void onStatusChanged(SessionStatusChangedEvent change) {
    if (change.isTerminal()) {
      locks.withLock(change.getSessionId(), () -> {
        cursors.remove(change.getSessionId());
      });
    }
  }

  private void notifyAppended(TimelineEvent event) {
    try {
      eventPublisher.publishEvent(new TimelineAppendedEvent(event));
    } catch (RuntimeException e) {
      log.warn("Failed to notify subscribers: sessionId={}, seq={}", event.getSessionId(),
        event.getSequence(), e);
    }
  }

  private Cursor loadCursor(String sessionId) {
    Cursor cursor = new Cursor();
    repository.findFirstBySessionIdOrderBySeqDesc(sessionId).ifPresent(last -> {
      cursor.lastSequence = last.getSeq();
      cursor.lastTimestamp = last.getOccurredAt();
    });
    return cursor;
  }

  private static final class Cursor {

    long lastSequence;
    OffsetDateTime lastTimestamp;
  }
}
