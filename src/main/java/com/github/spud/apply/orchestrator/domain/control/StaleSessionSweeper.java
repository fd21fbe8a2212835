package com.github.spud.apply.orchestrator.domain.control;

import com.github.spud.apply.orchestrator.application.config.OrchestratorProperties;
import com.github.spud.apply.orchestrator.domain.error.InvalidStateException;
import com.github.spud.apply.orchestrator.domain.error.InvalidTransitionException;
import com.github.spud.apply.orchestrator.domain.error.SessionNotFoundException;
import com.github.spud.apply.orchestrator.domain.session.SessionRegistry;
import com.github.spud.apply.orchestrator.domain.session.SessionSnapshot;
import com.github.spud.apply.orchestrator.domain.session.SessionStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fails RUNNING sessions whose agent has stopped ingesting.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleSessionSweeper {

  private final SessionRegistry sessionRegistry;
  private final ControlPlane controlPlane;
  private final OrchestratorProperties properties;
  private final Clock clock;

  @Scheduled(fixedDelayString = "${orchestrator.sweep.interval:PT30S}",
    initialDelayString = "${orchestrator.sweep.interval:PT30S}")
  public void scheduledSweep() {
    if (!properties.getSweep().isEnabled()) {
      return;
    }
    try {
      sweep(clock.instant());
    } catch (RuntimeException e) {
      log.error("Stale session sweep failed", e);
    }
  }

  /**
   * @return number of sessions failed by this pass
   */
  public int sweep(Instant now) {
    Duration staleAfter = properties.getSweep().getStaleAfter();
    int expired = 0;
    for (SessionSnapshot session : sessionRegistry.list(SessionStatus.RUNNING)) {
      Instant lastSeen = sessionRegistry.lastActivity(session);
      Duration idle = Duration.between(lastSeen, now);
      if (idle.compareTo(staleAfter) < 0) {
        continue;
      }
      try {
        if (controlPlane.expire(session.getSessionId(), staleAfter, now).isPresent()) {
          expired++;
        }
      } catch (InvalidStateException | InvalidTransitionException | SessionNotFoundException e) {
        // paused, finished or removed since the listing
        log.debug("Skipped stale session: sessionId={}, reason={}", session.getSessionId(),
          e.getMessage());
      }
    }
    if (expired > 0) {
      log.warn("Expired stale sessions: count={}, staleAfter={}", expired, staleAfter);
    }
    return expired;
  }
}
