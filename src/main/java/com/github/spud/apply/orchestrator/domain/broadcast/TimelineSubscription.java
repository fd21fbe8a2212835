package com.github.spud.apply.orchestrator.domain.broadcast;

import com.github.spud.apply.orchestrator.domain.timeline.TimelineEvent;
import java.util.List;
import lombok.Value;
import reactor.core.publisher.Flux;

/**
 * Result of subscribing to a session: every event up to {@code boundarySequence}, then a live
 * stream of every later event, with no gap and no duplicate between the two.
 */
@Value
public class TimelineSubscription {

  String sessionId;

  List<TimelineEvent> snapshot;

  /**
   * Sequence of the last snapshot event, or the requested catch-up point when the snapshot is
   * empty
   */
  long boundarySequence;

  Flux<TimelineEvent> live;

  /**
   * Snapshot followed by the live stream
   */
  public Flux<TimelineEvent> all() {
    return Flux.fromIterable(snapshot).concatWith(live);
  }
}
