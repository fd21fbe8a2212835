package com.github.spud.apply.orchestrator.domain.gateway;

import com.github.spud.apply.orchestrator.application.config.OrchestratorProperties;
import com.github.spud.apply.orchestrator.application.config.OrchestratorProperties.ErrorPolicy;
import com.github.spud.apply.orchestrator.domain.broadcast.BroadcastHub;
import com.github.spud.apply.orchestrator.domain.broadcast.TimelineSubscription;
import com.github.spud.apply.orchestrator.domain.control.ControlPlane;
import com.github.spud.apply.orchestrator.domain.control.SessionControlToken;
import com.github.spud.apply.orchestrator.domain.error.InvalidStateException;
import com.github.spud.apply.orchestrator.domain.error.SessionNotFoundException;
import com.github.spud.apply.orchestrator.domain.session.ProgressUpdate;
import com.github.spud.apply.orchestrator.domain.session.SessionRegistry;
import com.github.spud.apply.orchestrator.domain.session.SessionSnapshot;
import com.github.spud.apply.orchestrator.domain.session.SessionStatus;
import com.github.spud.apply.orchestrator.domain.timeline.TimelineEvent;
import com.github.spud.apply.orchestrator.domain.timeline.TimelineEventType;
import com.github.spud.apply.orchestrator.domain.timeline.TimelineStore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Single entry point for operators and agents.
 * <p>
 * Operators create sessions, query them, watch their timelines and issue control commands.
 * Agents report events, status changes and progress. Ingestion derives the session's progress
 * fields from each event and applies the error policy and the review gate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionGateway {

  static final String REVIEW_PAUSE_REASON = "Ready to submit application - paused for final review";

  private static final Set<SessionStatus> ACTIVE = EnumSet.of(SessionStatus.QUEUED,
    SessionStatus.RUNNING, SessionStatus.PAUSED);

  private final SessionRegistry sessionRegistry;
  private final TimelineStore timelineStore;
  private final BroadcastHub broadcastHub;
  private final ControlPlane controlPlane;
  private final ToolCallDescriber toolCallDescriber;
  private final AgentTaskLauncher agentTaskLauncher;
  private final OrchestratorProperties properties;

  // ===== Operator side =====

  public SessionSnapshot create(String jobReference, String resumeReference, String sessionId) {
    SessionSnapshot created = sessionRegistry.create(jobReference, resumeReference, sessionId);
    return launch(created);
  }

  /**
   * One QUEUED session per job reference, all sharing the same resume. The batch is validated
   * as a whole before any session is created.
   */
  public List<SessionSnapshot> createBatch(List<String> jobReferences, String resumeReference) {
    if (jobReferences == null || jobReferences.isEmpty()) {
      throw new IllegalArgumentException("jobReferences must not be empty");
    }
    if (!StringUtils.hasText(resumeReference)) {
      throw new IllegalArgumentException("resumeReference must not be blank");
    }
    Set<String> seen = new HashSet<>();
    for (String jobReference : jobReferences) {
      if (!StringUtils.hasText(jobReference)) {
        throw new IllegalArgumentException("jobReferences must not contain blank entries");
      }
      if (!seen.add(jobReference.trim())) {
        throw new IllegalArgumentException("Duplicate job reference in batch: " + jobReference);
      }
    }

    List<SessionSnapshot> created = new ArrayList<>(jobReferences.size());
    for (String jobReference : jobReferences) {
      created.add(create(jobReference.trim(), resumeReference, null));
    }
    log.info("Created session batch: size={}, resumeReference={}", created.size(),
      resumeReference);
    return created;
  }

  public List<SessionSnapshot> list(SessionStatus status) {
    return sessionRegistry.list(status);
  }

  public SessionSnapshot get(String sessionId) {
    return sessionRegistry.get(sessionId);
  }

  public List<TimelineEvent> timeline(String sessionId, Long sinceSequence) {
    return timelineStore.list(sessionId, sinceSequence);
  }

  public TimelineSubscription subscribe(String sessionId, Long sinceSequence) {
    return broadcastHub.subscribe(sessionId, sinceSequence);
  }

  public SessionSnapshot pause(String sessionId, String reason) {
    return controlPlane.pause(sessionId, reason);
  }

  public SessionSnapshot resume(String sessionId, String message) {
    return controlPlane.resume(sessionId, message);
  }

  public SessionSnapshot cancel(String sessionId, String reason) {
    return controlPlane.cancel(sessionId, reason);
  }

  public FocusView focus(String sessionId) {
    SessionSnapshot session = sessionRegistry.get(sessionId);
    String viewerUrl = properties.getFocus().getViewerUrl();
    return FocusView.builder()
      .sessionId(session.getSessionId())
      .tabIndex(session.getTabIndex())
      .screenshotLocation(session.getScreenshotLocation())
      .viewerUrl(StringUtils.hasText(viewerUrl) ? viewerUrl : null)
      .build();
  }

  // ===== Agent side =====

  /**
   * Record an agent-reported event and derive the session's progress from it
   *
   * @throws SessionNotFoundException unknown session
   * @throws InvalidStateException    session already terminal
   */
  public TimelineEvent ingest(String sessionId, IngestedEvent ingested) {
    TimelineEventType eventType = ingested.getEventType();
    if (eventType == null) {
      throw new IllegalArgumentException("eventType is required");
    }
    if (eventType == TimelineEventType.PAUSE || eventType == TimelineEventType.RESUME) {
      throw new IllegalArgumentException(
        eventType.getWireName() + " events are only recorded by status changes");
    }

    Map<String, Object> metadata = ingested.getMetadata() != null
      ? new LinkedHashMap<>(ingested.getMetadata()) : new LinkedHashMap<>();
    String content = ingested.getContent();
    if (eventType == TimelineEventType.TOOL_CALL && !StringUtils.hasText(content)) {
      Object tool = metadata.get("tool");
      if (tool != null) {
        content = toolCallDescriber.describe(tool.toString(), argumentsOf(metadata));
      }
    }

    String description = content;
    TimelineEvent event = sessionRegistry.whileActive(sessionId, () -> {
      TimelineEvent appended = timelineStore.append(sessionId, eventType, description, metadata,
        ingested.getScreenshotLocation());
      sessionRegistry.touch(sessionId);
      return appended;
    });
    applyProgress(event);

    if (event.getEventType() == TimelineEventType.ERROR) {
      applyErrorPolicy(event);
    } else if (event.getEventType() == TimelineEventType.TOOL_CALL) {
      applyReviewGate(event);
    }
    return event;
  }

  /**
   * Status change reported by the agent. Pause and resume go through the control plane so that
   * their timeline events are recorded.
   */
  public SessionSnapshot reportStatus(String sessionId, SessionStatus target, String detail) {
    if (target == null) {
      throw new IllegalArgumentException("status is required");
    }
    SessionSnapshot current = sessionRegistry.get(sessionId);
    sessionRegistry.touch(sessionId);
    if (target == SessionStatus.PAUSED) {
      return controlPlane.pause(sessionId, detail);
    }
    if (target == SessionStatus.RUNNING && current.getStatus() == SessionStatus.PAUSED) {
      return controlPlane.resume(sessionId, detail);
    }
    return sessionRegistry.transition(sessionId, target, detail);
  }

  public SessionSnapshot updateProgress(String sessionId, ProgressUpdate update) {
    SessionSnapshot updated = sessionRegistry.updateProgress(sessionId, update);
    sessionRegistry.touch(sessionId);
    return updated;
  }

  private SessionSnapshot launch(SessionSnapshot session) {
    String sessionId = session.getSessionId();
    SessionControlToken token = controlPlane.tokenFor(sessionId);
    try {
      agentTaskLauncher.launch(session, token);
      return sessionRegistry.get(sessionId);
    } catch (RuntimeException e) {
      log.error("Failed to launch agent: sessionId={}", sessionId, e);
      String detail = "Failed to launch agent: "
        + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
      return sessionRegistry.transitionFrom(sessionId, ACTIVE, SessionStatus.FAILED, detail);
    }
  }

  private void applyProgress(TimelineEvent event) {
    ProgressUpdate.ProgressUpdateBuilder update = ProgressUpdate.builder();
    switch (event.getEventType()) {
      case TOOL_CALL -> update.currentStep(event.getContent());
      case THOUGHT -> update.currentThought(event.getContent());
      case SCREENSHOT -> update.screenshotLocation(event.getScreenshotLocation());
      default -> {
      }
    }
    Integer tabIndex = tabIndexOf(event.getMetadata());
    if (tabIndex != null) {
      update.tabIndex(tabIndex);
    }

    ProgressUpdate progress = update.build();
    if (progress.isEmpty()) {
      return;
    }
    try {
      sessionRegistry.updateProgress(event.getSessionId(), progress);
    } catch (InvalidStateException e) {
      // finished after the append; the event precedes the terminal transition
      log.debug("Skipped progress update: sessionId={}, status={}", event.getSessionId(),
        e.getActual());
    }
  }

  private void applyErrorPolicy(TimelineEvent event) {
    String sessionId = event.getSessionId();
    ErrorPolicy policy = properties.getIngestion().getErrorPolicy();
    boolean fatal = isTrue(event.getMetadata().get("fatal"));
    String reason = StringUtils.hasText(event.getContent()) ? event.getContent()
      : "Agent reported an error";

    try {
      if (fatal || policy == ErrorPolicy.FAIL) {
        sessionRegistry.transitionFrom(sessionId, ACTIVE, SessionStatus.FAILED, reason);
      } else if (policy == ErrorPolicy.PAUSE) {
        SessionSnapshot session = sessionRegistry.get(sessionId);
        if (session.getStatus() == SessionStatus.RUNNING) {
          controlPlane.pause(sessionId, reason);
        }
      }
    } catch (InvalidStateException e) {
      log.warn("Error policy not applied: sessionId={}, policy={}, status={}", sessionId,
        fatal ? "FATAL" : policy, e.getActual());
    }
  }

  private void applyReviewGate(TimelineEvent event) {
    OrchestratorProperties.ReviewGate gate = properties.getReviewGate();
    if (!gate.isEnabled()) {
      return;
    }
    Map<String, Object> metadata = event.getMetadata();
    if (!"browser_click".equals(metadata.get("tool"))) {
      return;
    }
    Object element = argumentsOf(metadata).get("element");
    if (element == null) {
      element = metadata.get("element");
    }
    if (element == null) {
      return;
    }
    String target = element.toString().toLowerCase(Locale.ROOT);
    boolean submitting = gate.getKeywords().stream()
      .anyMatch(keyword -> target.contains(keyword.toLowerCase(Locale.ROOT)));
    if (!submitting) {
      return;
    }

    String sessionId = event.getSessionId();
    try {
      if (sessionRegistry.get(sessionId).getStatus() == SessionStatus.RUNNING) {
        controlPlane.pause(sessionId, REVIEW_PAUSE_REASON);
        log.info("Paused for final review: sessionId={}, element={}", sessionId, element);
      }
    } catch (InvalidStateException e) {
      log.debug("Review gate skipped: sessionId={}, status={}", sessionId, e.getActual());
    }
  }

  private static Map<?, ?> argumentsOf(Map<String, Object> metadata) {
    Object arguments = metadata.get("arguments");
    if (arguments instanceof Map<?, ?> map) {
      return map;
    }
    return Collections.emptyMap();
  }

  private static Integer tabIndexOf(Map<String, Object> metadata) {
    Object value = metadata.get("tab_index");
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String text && StringUtils.hasText(text)) {
      try {
        return Integer.valueOf(text.trim());
      } catch (NumberFormatException e) {
        log.debug("Ignoring non-numeric tab_index: {}", text);
      }
    }
    return null;
  }

  private static boolean isTrue(Object value) {
    return value instanceof Boolean flag ? flag : value != null && "true".equalsIgnoreCase(
      value.toString());
  }
}
