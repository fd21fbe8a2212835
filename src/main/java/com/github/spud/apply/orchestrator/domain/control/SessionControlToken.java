package com.github.spud.apply.orchestrator.domain.control;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import reactor.core.publisher.Mono;

/**
 * Cooperative control signal handed to the agent task that drives one session.
 * <p>
 * The agent polls it between discrete automation actions, never in the middle of one: when a
 * pause is requested it stops issuing actions and waits for {@link #awaitResume(Duration)} or
 * {@link #whenResumed()}; when cancelled it abandons the session.
 */
public class SessionControlToken {

  private final String sessionId;

  private CompletableFuture<Void> resumeGate = CompletableFuture.completedFuture(null);
  private volatile boolean cancelled;

  public SessionControlToken(String sessionId) {
    this.sessionId = sessionId;
  }

  public String getSessionId() {
    return sessionId;
  }

  public synchronized boolean isPauseRequested() {
    return !cancelled && !resumeGate.isDone();
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Block at a safe point until the pause is cleared.
   *
   * @return true when the agent may continue, false when the session was cancelled or the wait
   * timed out
   */
  public boolean awaitResume(Duration timeout) throws InterruptedException {
    CompletableFuture<Void> gate;
    synchronized (this) {
      gate = resumeGate;
    }
    try {
      gate.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      return false;
    } catch (ExecutionException e) {
      throw new IllegalStateException("Resume gate failed for session " + sessionId, e);
    }
    return !cancelled;
  }

  /**
   * Completes once the agent may continue; completes immediately when no pause is pending.
   */
  public synchronized Mono<Void> whenResumed() {
    return Mono.fromFuture(resumeGate, true);
  }

  synchronized void requestPause() {
    if (resumeGate.isDone()) {
      resumeGate = new CompletableFuture<>();
    }
  }

  synchronized void clearPause() {
    resumeGate.complete(null);
  }

  synchronized void cancel() {
    cancelled = true;
    resumeGate.complete(null);
  }

  @Override
  public String toString() {
    return "SessionControlToken{sessionId=" + sessionId + ", pauseRequested="
      + isPauseRequested() + ", cancelled=" + cancelled + "}";
  }
}
