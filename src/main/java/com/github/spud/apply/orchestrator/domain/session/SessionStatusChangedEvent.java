package com.github.spud.apply.orchestrator.domain.session;

import lombok.Value;

/**
 * Published after a transition has been written and the shard lock released.
 */
@Value
public class SessionStatusChangedEvent {

  String sessionId;
  SessionStatus from;
  SessionStatus to;
  SessionSnapshot session;

  public boolean isTerminal() {
    return to.isTerminal();
  }
}
