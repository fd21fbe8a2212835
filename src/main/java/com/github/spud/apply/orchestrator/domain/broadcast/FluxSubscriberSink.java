package com.github.spud.apply.orchestrator.domain.broadcast;

import com.github.spud.apply.orchestrator.domain.error.SubscriberOverflowException;
import com.github.spud.apply.orchestrator.domain.timeline.TimelineEvent;
import java.util.concurrent.ArrayBlockingQueue;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.publisher.Sinks.EmitResult;

/**
 * Subscriber sink backed by a unicast Reactor sink over a bounded queue. When the queue is full
 * the stream is terminated with {@link SubscriberOverflowException} after the queued events.
 */
@Slf4j
public class FluxSubscriberSink implements SubscriberSink {

  private final String sessionId;
  private final Sinks.Many<TimelineEvent> sink;

  private volatile long boundary;
  private long lastAccepted;
  private boolean closed;

  public FluxSubscriberSink(String sessionId, int capacity) {
    this.sessionId = sessionId;
    this.sink = Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(capacity));
  }

  @Override
  public String getSessionId() {
    return sessionId;
  }

  /**
   * Set the snapshot boundary; events at or below it are already in the snapshot.
   */
  void startAfter(long boundarySequence) {
    this.boundary = boundarySequence;
  }

  /**
   * Live events strictly after the snapshot boundary
   */
  public Flux<TimelineEvent> asFlux() {
    return sink.asFlux().filter(e -> e.getSequence() > boundary);
  }

  @Override
  public synchronized boolean push(TimelineEvent event) {
    if (closed) {
      return false;
    }
    EmitResult result = sink.tryEmitNext(event);
    if (result.isSuccess()) {
      lastAccepted = event.getSequence();
      return true;
    }
    if (result == EmitResult.FAIL_OVERFLOW) {
      long resumeFrom = Math.max(boundary, lastAccepted);
      closed = true;
      sink.tryEmitError(new SubscriberOverflowException(sessionId, resumeFrom));
      return false;
    }
    // cancelled or already terminated by the consumer
    log.debug("Subscriber rejected event: sessionId={}, seq={}, result={}", sessionId,
      event.getSequence(), result);
    closed = true;
    return false;
  }

  @Override
  public synchronized void close(Throwable reason) {
    if (closed) {
      return;
    }
    closed = true;
    if (reason == null) {
      sink.tryEmitComplete();
    } else {
      sink.tryEmitError(reason);
    }
  }

  @Override
  public synchronized boolean isClosed() {
    return closed;
  }
}
