package com.github.spud.apply.orchestrator.domain.broadcast;

import com.github.spud.apply.orchestrator.application.config.OrchestratorProperties;
import com.github.spud.apply.orchestrator.domain.error.SessionNotFoundException;
import com.github.spud.apply.orchestrator.domain.session.SessionRegistry;
import com.github.spud.apply.orchestrator.domain.session.SessionSnapshot;
import com.github.spud.apply.orchestrator.domain.session.SessionStatusChangedEvent;
import com.github.spud.apply.orchestrator.domain.timeline.TimelineAppendedEvent;
import com.github.spud.apply.orchestrator.domain.timeline.TimelineEvent;
import com.github.spud.apply.orchestrator.domain.timeline.TimelineStore;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Per-session fan-out of appended timeline events to live subscribers.
 * <p>
 * Holds no events and no durable state, only the sinks of current subscribers. A subscriber is
 * attached before its snapshot is read, and its live stream only passes events after the
 * snapshot's last sequence: an event appended before the attach is durable before the snapshot
 * read, and one appended after it is pushed to the sink.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BroadcastHub {

  private final TimelineStore timelineStore;
  private final SessionRegistry sessionRegistry;
  private final OrchestratorProperties properties;

  private final Map<String, Set<SubscriberSink>> subscribers = new ConcurrentHashMap<>();

  public TimelineSubscription subscribe(String sessionId) {
    return subscribe(sessionId, null);
  }

  /**
   * Snapshot of events after {@code sinceSequence} plus a live stream of everything appended
   * later. The live stream ends with {@code SubscriberOverflowException} if its consumer falls
   * behind, and completes shortly after the session turns terminal.
   *
   * @throws SessionNotFoundException unknown session
   */
  public TimelineSubscription subscribe(String sessionId, Long sinceSequence) {
    if (!sessionRegistry.exists(sessionId)) {
      throw new SessionNotFoundException(sessionId);
    }

    FluxSubscriberSink sink = new FluxSubscriberSink(sessionId,
      properties.getBroadcast().getSubscriberQueueCapacity());
    attach(sessionId, sink);

    List<TimelineEvent> snapshot;
    try {
      snapshot = timelineStore.list(sessionId, sinceSequence);
    } catch (RuntimeException e) {
      detach(sessionId, sink);
      throw e;
    }

    long since = sinceSequence == null ? 0L : Math.max(0L, sinceSequence);
    long boundary = snapshot.isEmpty() ? since : snapshot.get(snapshot.size() - 1).getSequence();
    sink.startAfter(boundary);

    Flux<TimelineEvent> live = sink.asFlux()
      .doFinally(signal -> detach(sessionId, sink));

    SessionSnapshot session = sessionRegistry.get(sessionId);
    if (session.isTerminal()) {
      closeLater(sink);
    }

    log.info("Subscribed to session: sessionId={}, snapshotSize={}, boundary={}", sessionId,
      snapshot.size(), boundary);
    return new TimelineSubscription(sessionId, snapshot, boundary, live);
  }

  /**
   * Fan an appended event out to the session's subscribers. Runs on the appending thread while
   * the timeline store holds the session lock, and never blocks.
   */
  @EventListener
  public void onTimelineAppended(TimelineAppendedEvent appended) {
    TimelineEvent event = appended.getEvent();
    Set<SubscriberSink> sinks = subscribers.get(event.getSessionId());
    if (sinks == null || sinks.isEmpty()) {
      return;
    }
    for (SubscriberSink sink : sinks) {
      if (!sink.push(event)) {
        log.warn("Dropping subscriber: sessionId={}, seq={}", event.getSessionId(),
          event.getSequence());
        detach(event.getSessionId(), sink);
      }
    }
  }

  /**
   * Complete every live stream of a session once it has turned terminal.
   */
  @EventListener
  public void onStatusChanged(SessionStatusChangedEvent change) {
    if (!change.isTerminal()) {
      return;
    }
    Set<SubscriberSink> sinks = subscribers.get(change.getSessionId());
    if (sinks == null) {
      return;
    }
    for (SubscriberSink sink : sinks) {
      closeLater(sink);
    }
  }

  public int subscriberCount(String sessionId) {
    Set<SubscriberSink> sinks = subscribers.get(sessionId);
    return sinks == null ? 0 : sinks.size();
  }

  void attach(String sessionId, SubscriberSink sink) {
    subscribers.compute(sessionId, (id, sinks) -> {
      Set<SubscriberSink> target = sinks != null ? sinks : ConcurrentHashMap.newKeySet();
      target.add(sink);
      return target;
    });
  }

  void detach(String sessionId, SubscriberSink sink) {
    subscribers.computeIfPresent(sessionId, (id, sinks) -> {
      sinks.remove(sink);
      return sinks.isEmpty() ? null : sinks;
    });
  }

  private void closeLater(SubscriberSink sink) {
    Duration grace = properties.getBroadcast().getTerminalGrace();
    Mono.delay(grace).subscribe(tick -> {
      sink.close(null);
      detach(sink.getSessionId(), sink);
    });
  }
}
