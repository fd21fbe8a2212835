package com.github.spud.apply.orchestrator.domain.control;

import com.github.spud.apply.orchestrator.application.config.OrchestratorProperties;
import com.github.spud.apply.orchestrator.domain.error.InvalidStateException;
import com.github.spud.apply.orchestrator.domain.error.SessionNotFoundException;
import com.github.spud.apply.orchestrator.domain.session.SessionRegistry;
import com.github.spud.apply.orchestrator.domain.session.SessionSnapshot;
import com.github.spud.apply.orchestrator.domain.session.SessionStatus;
import com.github.spud.apply.orchestrator.domain.session.SessionStatusChangedEvent;
import com.github.spud.apply.orchestrator.domain.timeline.TimelineEventType;
import com.github.spud.apply.orchestrator.domain.timeline.TimelineStore;
import com.github.spud.apply.orchestrator.util.StripedLock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Operator control of running sessions: pause, resume and cancel.
 * <p>
 * Each command applies the registry transition, records the matching timeline event and signals
 * the agent's {@link SessionControlToken}, all under a per-session control lock so that two
 * commands for the same session never interleave their events. The status is final when the
 * call returns; the agent honours the signal at its next safe point.
 */
@Slf4j
@Service
public class ControlPlane {

  private static final Set<SessionStatus> ACTIVE = EnumSet.of(SessionStatus.QUEUED,
    SessionStatus.RUNNING, SessionStatus.PAUSED);

  private final SessionRegistry sessionRegistry;
  private final TimelineStore timelineStore;

  private final StripedLock controlLocks;
  private final Map<String, SessionControlToken> tokens = new ConcurrentHashMap<>();

  public ControlPlane(SessionRegistry sessionRegistry, TimelineStore timelineStore,
    OrchestratorProperties properties) {
    this.sessionRegistry = sessionRegistry;
    this.timelineStore = timelineStore;
    this.controlLocks = new StripedLock(properties.getRegistry().getShards());
  }

  /**
   * Token the agent task for this session polls between actions
   *
   * @throws SessionNotFoundException unknown session
   */
  public SessionControlToken tokenFor(String sessionId) {
    SessionControlToken existing = tokens.get(sessionId);
    if (existing != null) {
      return existing;
    }
    SessionSnapshot session = sessionRegistry.get(sessionId);
    SessionControlToken token = tokens.computeIfAbsent(sessionId, SessionControlToken::new);
    if (session.getStatus() == SessionStatus.PAUSED) {
      token.requestPause();
    } else if (session.isTerminal()) {
      tokens.remove(sessionId, token);
      token.cancel();
    }
    return token;
  }

  public Optional<SessionControlToken> findToken(String sessionId) {
    return Optional.ofNullable(tokens.get(sessionId));
  }

  /**
   * RUNNING → PAUSED, then a pause request on the agent's token, then a pause event
   *
   * @throws InvalidStateException session is not RUNNING
   */
  public SessionSnapshot pause(String sessionId, String reason) {
    return controlLocks.withLock(sessionId, () -> {
      SessionSnapshot paused = sessionRegistry.transitionFrom(sessionId,
        EnumSet.of(SessionStatus.RUNNING), SessionStatus.PAUSED, null);

      String content = StringUtils.hasText(reason) ? reason : "Paused by operator";
      tokenFor(sessionId).requestPause();
      record(sessionId, TimelineEventType.PAUSE, content, details("reason", content));

      log.info("Paused session: sessionId={}, reason={}", sessionId, content);
      return paused;
    });
  }

  /**
   * PAUSED → RUNNING, then the agent's pause request is cleared, then a resume event
   *
   * @throws InvalidStateException session is not PAUSED
   */
  public SessionSnapshot resume(String sessionId, String message) {
    return controlLocks.withLock(sessionId, () -> {
      SessionSnapshot resumed = sessionRegistry.transitionFrom(sessionId,
        EnumSet.of(SessionStatus.PAUSED), SessionStatus.RUNNING, null);

      String content = StringUtils.hasText(message) ? message : "Agent resumed by user";
      tokenFor(sessionId).clearPause();
      record(sessionId, TimelineEventType.RESUME, content, details("message", content));

      log.info("Resumed session: sessionId={}", sessionId);
      return resumed;
    });
  }

  /**
   * Any non-terminal status → FAILED with a cancellation detail, recorded as an error event
   *
   * @throws InvalidStateException session is already terminal
   */
  public SessionSnapshot cancel(String sessionId, String reason) {
    String detail = "Cancelled: " + (StringUtils.hasText(reason) ? reason : "by operator");
    return failAndRecord(sessionId, ACTIVE, null, detail, "cancelled").orElseThrow();
  }

  /**
   * RUNNING → FAILED for a session whose agent has been silent for at least {@code staleAfter}
   * at {@code now}. Idleness is re-checked under the session lock, so an agent that reported in
   * since the caller looked keeps its session.
   *
   * @return the failed session, or empty when the agent is no longer idle
   * @throws InvalidStateException session is no longer RUNNING
   */
  public Optional<SessionSnapshot> expire(String sessionId, Duration staleAfter, Instant now) {
    Predicate<SessionSnapshot> stillIdle = session -> idleFor(session, now)
      .compareTo(staleAfter) >= 0;
    Duration idle = idleFor(sessionRegistry.get(sessionId), now);
    String detail = String.format("Timed out: no agent activity for %ds", idle.toSeconds());
    return failAndRecord(sessionId, EnumSet.of(SessionStatus.RUNNING), stillIdle, detail,
      "timeout");
  }

  private Duration idleFor(SessionSnapshot session, Instant now) {
    return Duration.between(sessionRegistry.lastActivity(session), now);
  }

  private Optional<SessionSnapshot> failAndRecord(String sessionId, Set<SessionStatus> expected,
    Predicate<SessionSnapshot> condition, String detail, String cause) {
    SessionControlToken token = tokens.get(sessionId);
    Optional<SessionSnapshot> failed = controlLocks.withLock(sessionId, () -> {
      Optional<SessionSnapshot> result = sessionRegistry.transitionIf(sessionId, expected,
        condition != null ? condition : session -> true, SessionStatus.FAILED, detail);
      if (result.isPresent()) {
        Map<String, Object> metadata = details("error", detail);
        metadata.put("cause", cause);
        record(sessionId, TimelineEventType.ERROR, detail, metadata);
      }
      return result;
    });
    if (failed.isEmpty()) {
      log.debug("Session no longer eligible: sessionId={}, cause={}", sessionId, cause);
      return failed;
    }
    if (token != null) {
      token.cancel();
    }
    log.info("Failed session: sessionId={}, cause={}, detail={}", sessionId, cause, detail);
    return failed;
  }

  private void record(String sessionId, TimelineEventType type, String content,
    Map<String, Object> metadata) {
    try {
      timelineStore.append(sessionId, type, content, metadata, null);
    } catch (RuntimeException e) {
      SessionStatus status = sessionRegistry.find(sessionId).map(SessionSnapshot::getStatus)
        .orElse(null);
      log.error("Status changed but {} event not recorded: sessionId={}, status={}", type,
        sessionId, status, e);
      throw e;
    }
  }

  /**
   * Release agents waiting on a token once their session has finished, whoever finished it.
   */
  @EventListener
  public void onStatusChanged(SessionStatusChangedEvent change) {
    if (change.isTerminal()) {
      SessionControlToken token = tokens.remove(change.getSessionId());
      if (token != null) {
        token.cancel();
      }
    }
  }

  private static Map<String, Object> details(String key, String value) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(key, value);
    return metadata;
  }
}
