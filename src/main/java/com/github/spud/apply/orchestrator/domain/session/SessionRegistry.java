package com.github.spud.apply.orchestrator.domain.session;

import com.github.spud.apply.orchestrator.application.config.OrchestratorProperties;
import com.github.spud.apply.orchestrator.domain.error.DuplicateSessionException;
import com.github.spud.apply.orchestrator.domain.error.InvalidStateException;
import com.github.spud.apply.orchestrator.domain.error.InvalidTransitionException;
import com.github.spud.apply.orchestrator.domain.error.SessionNotFoundException;
import com.github.spud.apply.orchestrator.domain.state.SessionStateMachineDriver;
import com.github.spud.apply.orchestrator.infrastructure.persistence.entity.ApplicationSession;
import com.github.spud.apply.orchestrator.infrastructure.persistence.repository.ApplicationSessionRepository;
import com.github.spud.apply.orchestrator.util.StripedLock;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Owner of session records and their lifecycle.
 * <p>
 * Records live in a map sharded by session id; every read-validate-write runs under the shard
 * lock and writes through to the database before the lock is released. Status-change
 * notifications are published after the lock is released.
 */
@Slf4j
@Service
public class SessionRegistry {

  private final ApplicationSessionRepository repository;
  private final SessionStateMachineDriver stateMachineDriver;
  private final ApplicationEventPublisher eventPublisher;
  private final OrchestratorProperties properties;
  private final Clock clock;

  private final StripedLock shards;
  private final Map<String, SessionRecord> sessions = new ConcurrentHashMap<>();
  private final Map<String, Instant> lastActivity = new ConcurrentHashMap<>();

  public SessionRegistry(ApplicationSessionRepository repository,
    SessionStateMachineDriver stateMachineDriver, ApplicationEventPublisher eventPublisher,
    OrchestratorProperties properties, Clock clock) {
    this.repository = repository;
    this.stateMachineDriver = stateMachineDriver;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
    this.shards = new StripedLock(properties.getRegistry().getShards());
  }

  public String create(String jobReference, String resumeReference) {
    return create(jobReference, resumeReference, null).getSessionId();
  }

  /**
   * Allocate a new QUEUED session
   *
   * @param requestedId caller-supplied id, or null to generate one
   * @throws DuplicateSessionException if {@code requestedId} is already taken
   */
  public SessionSnapshot create(String jobReference, String resumeReference, String requestedId) {
    if (!StringUtils.hasText(jobReference)) {
      throw new IllegalArgumentException("jobReference must not be blank");
    }
    if (!StringUtils.hasText(resumeReference)) {
      throw new IllegalArgumentException("resumeReference must not be blank");
    }
    String sessionId = StringUtils.hasText(requestedId) ? requestedId
      : UUID.randomUUID().toString();

    SessionSnapshot created = shards.withLock(sessionId, () -> {
      if (sessions.containsKey(sessionId) || repository.existsById(sessionId)) {
        throw new DuplicateSessionException(sessionId);
      }

      OffsetDateTime now = now();
      SessionRecord record = SessionRecord.builder()
        .sessionId(sessionId)
        .jobReference(jobReference)
        .resumeReference(resumeReference)
        .status(SessionStatus.QUEUED)
        .currentStep("Queued")
        .screenshotDir(screenshotDir(sessionId, now.toLocalDate()))
        .createdAt(now)
        .updatedAt(now)
        .build();

      repository.save(record.toEntity());
      sessions.put(sessionId, record);
      lastActivity.put(sessionId, now.toInstant());
      return record.toSnapshot();
    });

    log.info("Created session: sessionId={}, jobReference={}, resumeReference={}", sessionId,
      jobReference, resumeReference);
    return created;
  }

  /**
   * Move a session along the lifecycle
   *
   * @param detail error detail when moving to FAILED, ignored otherwise
   * @throws SessionNotFoundException   unknown session
   * @throws InvalidTransitionException edge not in the lifecycle
   */
  public SessionSnapshot transition(String sessionId, SessionStatus target, String detail) {
    return transition(sessionId, null, target, detail);
  }

  public SessionSnapshot transition(String sessionId, SessionStatus target) {
    return transition(sessionId, target, null);
  }

  /**
   * Move a session along the lifecycle, requiring its current status to be one of
   * {@code expected}. The check and the write happen under the same lock.
   *
   * @throws InvalidStateException current status is not in {@code expected}
   */
  public SessionSnapshot transitionFrom(String sessionId, Set<SessionStatus> expected,
    SessionStatus target, String detail) {
    return transition(sessionId, EnumSet.copyOf(expected), target, detail);
  }

  /**
   * Like {@link #transitionFrom}, but leaves the session alone when {@code condition} does not
   * hold for its current state. The condition is evaluated under the shard lock.
   *
   * @return the new state, or empty when the condition did not hold
   * @throws InvalidStateException current status is not in {@code expected}
   */
  public Optional<SessionSnapshot> transitionIf(String sessionId, Set<SessionStatus> expected,
    Predicate<SessionSnapshot> condition, SessionStatus target, String detail) {
    return Optional.ofNullable(
      apply(sessionId, EnumSet.copyOf(expected), condition, target, detail));
  }

  private SessionSnapshot transition(String sessionId, Set<SessionStatus> expected,
    SessionStatus target, String detail) {
    return apply(sessionId, expected, null, target, detail);
  }

  private SessionSnapshot apply(String sessionId, Set<SessionStatus> expected,
    Predicate<SessionSnapshot> condition, SessionStatus target, String detail) {
    SessionStatusChangedEvent change = shards.withLock(sessionId, () -> {
      SessionRecord current = load(sessionId);
      SessionStatus from = current.getStatus();

      if (expected != null && !expected.contains(from)) {
        throw new InvalidStateException(sessionId, from, String.format(
          "Session %s is %s, expected one of %s", sessionId, from, expected));
      }
      if (condition != null && !condition.test(current.toSnapshot())) {
        return null;
      }
      if (stateMachineDriver.fire(sessionId, from, target).isEmpty()) {
        throw new InvalidTransitionException(sessionId, from, target);
      }

      OffsetDateTime now = now();
      SessionRecord next = current.toBuilder()
        .status(target)
        .updatedAt(now)
        .build();
      if (target.isTerminal()) {
        next.setCompletedAt(now);
      }
      if (target == SessionStatus.FAILED) {
        next.setErrorDetail(StringUtils.hasText(detail) ? detail
          : "Session failed while " + from.name().toLowerCase());
      }

      repository.save(next.toEntity());
      if (target.isTerminal()) {
        sessions.remove(sessionId);
        lastActivity.remove(sessionId);
      } else {
        sessions.put(sessionId, next);
        lastActivity.put(sessionId, now.toInstant());
      }
      return new SessionStatusChangedEvent(sessionId, from, target, next.toSnapshot());
    });

    if (change == null) {
      return null;
    }
    log.info("Session transition: sessionId={}, {} -> {}", sessionId, change.getFrom(),
      change.getTo());
    eventPublisher.publishEvent(change);
    return change.getSession();
  }

  /**
   * Run {@code action} while the session is guaranteed not to turn terminal. Transitions of the
   * session wait until the action returns.
   *
   * @throws SessionNotFoundException unknown session
   * @throws InvalidStateException    session already terminal
   */
  public <T> T whileActive(String sessionId, Supplier<T> action) {
    return shards.withLock(sessionId, () -> {
      SessionRecord current = load(sessionId);
      if (current.getStatus().isTerminal()) {
        throw new InvalidStateException(sessionId, current.getStatus(),
          "Session " + sessionId + " is " + current.getStatus() + " and can no longer change");
      }
      return action.get();
    });
  }

  /**
   * Overwrite the named progress fields without touching status
   *
   * @throws SessionNotFoundException unknown session
   * @throws InvalidStateException    session already terminal
   */
  public SessionSnapshot updateProgress(String sessionId, ProgressUpdate update) {
    return shards.withLock(sessionId, () -> {
      SessionRecord current = load(sessionId);
      if (current.getStatus().isTerminal()) {
        throw new InvalidStateException(sessionId, current.getStatus(),
          "Session " + sessionId + " is " + current.getStatus() + " and can no longer change");
      }
      if (update.isEmpty()) {
        return current.toSnapshot();
      }

      SessionRecord next = current.toBuilder().updatedAt(now()).build();
      if (update.getCurrentStep() != null) {
        next.setCurrentStep(update.getCurrentStep());
      }
      if (update.getCurrentThought() != null) {
        next.setCurrentThought(update.getCurrentThought());
      }
      if (update.getScreenshotLocation() != null) {
        next.setScreenshotLocation(update.getScreenshotLocation());
      }
      if (update.getTabIndex() != null) {
        next.setTabIndex(update.getTabIndex());
      }

      repository.save(next.toEntity());
      sessions.put(sessionId, next);
      log.debug("Updated progress: sessionId={}, step={}", sessionId, next.getCurrentStep());
      return next.toSnapshot();
    });
  }

  /**
   * @throws SessionNotFoundException unknown session
   */
  public SessionSnapshot get(String sessionId) {
    return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
  }

  public Optional<SessionSnapshot> find(String sessionId) {
    SessionRecord cached = sessions.get(sessionId);
    if (cached != null) {
      return Optional.of(cached.toSnapshot());
    }
    return repository.findById(sessionId).map(SessionRecord::fromEntity)
      .map(SessionRecord::toSnapshot);
  }

  public boolean exists(String sessionId) {
    return sessions.containsKey(sessionId) || repository.existsById(sessionId);
  }

  /**
   * Sessions in creation order, optionally restricted to one status
   */
  public List<SessionSnapshot> list(SessionStatus status) {
    List<ApplicationSession> rows = status == null
      ? repository.findAllByOrderByCreatedAtAsc()
      : repository.findAllByStatusOrderByCreatedAtAsc(status);
    return rows.stream()
      .map(SessionRecord::fromEntity)
      .map(SessionRecord::toSnapshot)
      .collect(Collectors.toList());
  }

  /**
   * Record ingestion activity for the stale-session sweep
   */
  public void touch(String sessionId) {
    shards.withLock(sessionId, () -> {
      if (sessions.containsKey(sessionId)) {
        lastActivity.put(sessionId, clock.instant());
      }
    });
  }

  /**
   * Last time anything was ingested for the session, falling back to its last update
   */
  public Instant lastActivity(SessionSnapshot session) {
    Instant seen = lastActivity.get(session.getSessionId());
    Instant updated = session.getUpdatedAt().toInstant();
    return seen == null || seen.isBefore(updated) ? updated : seen;
  }

  private SessionRecord load(String sessionId) {
    SessionRecord cached = sessions.get(sessionId);
    if (cached != null) {
      return cached;
    }
    SessionRecord loaded = repository.findById(sessionId)
      .map(SessionRecord::fromEntity)
      .orElseThrow(() -> new SessionNotFoundException(sessionId));
    if (!loaded.getStatus().isTerminal()) {
      sessions.put(sessionId, loaded);
    }
    return loaded;
  }

  private String screenshotDir(String sessionId, LocalDate day) {
    return String.format("%s/%s/screenshots/%s", properties.getScreenshots().getBaseDir(),
      day.format(DateTimeFormatter.ISO_LOCAL_DATE), sessionId);
  }

  private OffsetDateTime now() {
    return OffsetDateTime.now(clock);
  }
}
