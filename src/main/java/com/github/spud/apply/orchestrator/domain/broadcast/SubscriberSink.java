package com.github.spud.apply.orchestrator.domain.broadcast;

import com.github.spud.apply.orchestrator.domain.timeline.TimelineEvent;

/**
 * Outbound side of one live subscriber, independent of the transport carrying it.
 */
public interface SubscriberSink {

  String getSessionId();

  /**
   * Offer an event without blocking.
   *
   * @return false once the sink can no longer accept events; the hub then detaches it
   */
  boolean push(TimelineEvent event);

  /**
   * Terminate the stream; {@code reason} null means normal completion.
   */
  void close(Throwable reason);

  boolean isClosed();
}
