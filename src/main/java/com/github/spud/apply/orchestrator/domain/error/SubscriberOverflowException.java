package com.github.spud.apply.orchestrator.domain.error;

import lombok.Getter;

/**
 * Terminates a live stream whose consumer fell behind. The consumer re-subscribes with
 * {@code lastDeliveredSequence} as its catch-up point.
 */
@Getter
public class SubscriberOverflowException extends OrchestratorException {

  private final long lastDeliveredSequence;

  public SubscriberOverflowException(String sessionId, long lastDeliveredSequence) {
    super(sessionId, String.format(
      "Subscriber for session %s fell behind after sequence %d and was dropped", sessionId,
      lastDeliveredSequence));
    this.lastDeliveredSequence = lastDeliveredSequence;
  }

  @Override
  public String getCode() {
    return "SUBSCRIBER_OVERFLOW";
  }
}
