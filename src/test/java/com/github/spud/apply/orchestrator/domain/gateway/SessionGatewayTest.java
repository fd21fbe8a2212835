package com.github.spud.apply.orchestrator.domain.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import com.github.spud.apply.orchestrator.application.config.OrchestratorProperties;
import com.github.spud.apply.orchestrator.application.config.OrchestratorProperties.ErrorPolicy;
import com.github.spud.apply.orchestrator.domain.error.InvalidStateException;
import com.github.spud.apply.orchestrator.domain.session.SessionSnapshot;
import com.github.spud.apply.orchestrator.domain.session.SessionStatus;
import com.github.spud.apply.orchestrator.domain.timeline.TimelineEvent;
import com.github.spud.apply.orchestrator.domain.timeline.TimelineEventType;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
class SessionGatewayTest {

  @Autowired
  private SessionGateway gateway;

  @Autowired
  private OrchestratorProperties properties;

  @MockBean
  private AgentTaskLauncher launcher;

  @AfterEach
  void restoreDefaults() {
    properties.getIngestion().setErrorPolicy(ErrorPolicy.PAUSE);
    properties.getReviewGate().setEnabled(false);
  }

  @Test
  @DisplayName("J1/R1: create, run, pause, resume, complete")
  void endToEndScenario() {
    String id = gateway.create("J1", "R1", null).getSessionId();
    assertThat(gateway.get(id).getStatus()).isEqualTo(SessionStatus.QUEUED);

    gateway.reportStatus(id, SessionStatus.RUNNING, null);
    assertThat(gateway.get(id).getStatus()).isEqualTo(SessionStatus.RUNNING);

    gateway.ingest(id, toolCall("clicked Apply button"));

    gateway.pause(id, "needs CAPTCHA");
    assertThat(gateway.get(id).getStatus()).isEqualTo(SessionStatus.PAUSED);
    List<TimelineEvent> afterPause = gateway.timeline(id, null);
    assertThat(afterPause).hasSize(2);
    assertThat(afterPause.get(1).getEventType()).isEqualTo(TimelineEventType.PAUSE);

    gateway.resume(id, null);
    assertThat(gateway.get(id).getStatus()).isEqualTo(SessionStatus.RUNNING);
    List<TimelineEvent> afterResume = gateway.timeline(id, null);
    assertThat(afterResume).hasSize(3);
    assertThat(afterResume.get(2).getEventType()).isEqualTo(TimelineEventType.RESUME);

    gateway.ingest(id, toolCall("submitted form"));
    SessionSnapshot completed = gateway.reportStatus(id, SessionStatus.COMPLETED, null);

    assertThat(completed.getStatus()).isEqualTo(SessionStatus.COMPLETED);
    assertThat(completed.getCompletedAt()).isNotNull();
    assertThat(gateway.timeline(id, null)).hasSize(4)
      .extracting(TimelineEvent::getSequence).containsExactly(1L, 2L, 3L, 4L);
  }

  @Test
  void createShouldHandSessionToLauncher() {
    SessionSnapshot created = gateway.create("job", "resume", null);

    verify(launcher).launch(argThat(s -> s.getSessionId().equals(created.getSessionId())),
      argThat(t -> t.getSessionId().equals(created.getSessionId()) && !t.isCancelled()));
  }

  @Test
  void launchFailureShouldFailSession() {
    doThrow(new IllegalStateException("no browser slots"))
      .when(launcher).launch(argThat(s -> "job-no-slot".equals(s.getJobReference())), any());

    SessionSnapshot created = gateway.create("job-no-slot", "resume", null);

    assertThat(created.getStatus()).isEqualTo(SessionStatus.FAILED);
    assertThat(created.getErrorDetail()).isEqualTo("Failed to launch agent: no browser slots");
  }

  @Test
  void batchShouldCreateOneSessionPerJob() {
    List<SessionSnapshot> batch = gateway.createBatch(
      List.of("https://a.example/1", "https://b.example/2"), "resume-7");

    assertThat(batch).hasSize(2)
      .allSatisfy(s -> {
        assertThat(s.getStatus()).isEqualTo(SessionStatus.QUEUED);
        assertThat(s.getResumeReference()).isEqualTo("resume-7");
      })
      .extracting(SessionSnapshot::getJobReference)
      .containsExactly("https://a.example/1", "https://b.example/2");
  }

  @Test
  void invalidBatchShouldCreateNothing() {
    int before = gateway.list(null).size();

    assertThatThrownBy(() -> gateway.createBatch(
      List.of("https://a.example/dup", "https://a.example/dup"), "resume"))
      .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> gateway.createBatch(List.of("https://a.example/x", " "), "resume"))
      .isInstanceOf(IllegalArgumentException.class);

    assertThat(gateway.list(null)).hasSize(before);
  }

  @Test
  void ingestionShouldDeriveProgress() {
    String id = runningSession();

    gateway.ingest(id, IngestedEvent.builder()
      .eventType(TimelineEventType.THOUGHT)
      .content("The form wants a cover letter")
      .build());
    gateway.ingest(id, IngestedEvent.builder()
      .eventType(TimelineEventType.TOOL_CALL)
      .metadata(Map.of("tool", "browser_navigate",
        "arguments", Map.of("url", "https://jobs.example.com/42"), "tab_index", 2))
      .build());
    gateway.ingest(id, IngestedEvent.builder()
      .eventType(TimelineEventType.SCREENSHOT)
      .screenshotLocation("data/applications/s/step-2.png")
      .build());

    SessionSnapshot session = gateway.get(id);
    assertThat(session.getCurrentThought()).isEqualTo("The form wants a cover letter");
    assertThat(session.getCurrentStep()).isEqualTo("Navigating to https://jobs.example.com/42");
    assertThat(session.getScreenshotLocation()).isEqualTo("data/applications/s/step-2.png");
    assertThat(session.getTabIndex()).isEqualTo(2);

    FocusView focus = gateway.focus(id);
    assertThat(focus.getTabIndex()).isEqualTo(2);
    assertThat(focus.getScreenshotLocation()).isEqualTo("data/applications/s/step-2.png");
    assertThat(focus.getViewerUrl()).isNull();
  }

  @Test
  void errorShouldPauseRunningSessionByDefault() {
    String id = runningSession();

    gateway.ingest(id, IngestedEvent.builder()
      .eventType(TimelineEventType.ERROR)
      .content("Element not found: #submit")
      .build());

    assertThat(gateway.get(id).getStatus()).isEqualTo(SessionStatus.PAUSED);
    assertThat(gateway.timeline(id, null)).extracting(TimelineEvent::getEventType)
      .containsExactly(TimelineEventType.ERROR, TimelineEventType.PAUSE);
  }

  @Test
  void fatalErrorShouldFailSession() {
    String id = runningSession();

    gateway.ingest(id, IngestedEvent.builder()
      .eventType(TimelineEventType.ERROR)
      .content("Browser crashed")
      .metadata(Map.of("fatal", true))
      .build());

    SessionSnapshot session = gateway.get(id);
    assertThat(session.getStatus()).isEqualTo(SessionStatus.FAILED);
    assertThat(session.getErrorDetail()).isEqualTo("Browser crashed");
  }

  @Test
  void recordPolicyShouldOnlyRecordError() {
    properties.getIngestion().setErrorPolicy(ErrorPolicy.RECORD);
    String id = runningSession();

    gateway.ingest(id, IngestedEvent.builder()
      .eventType(TimelineEventType.ERROR)
      .content("Retrying upload")
      .build());

    assertThat(gateway.get(id).getStatus()).isEqualTo(SessionStatus.RUNNING);
    assertThat(gateway.timeline(id, null)).hasSize(1);
  }

  @Test
  void reviewGateShouldPauseBeforeSubmission() {
    properties.getReviewGate().setEnabled(true);
    String id = runningSession();

    gateway.ingest(id, IngestedEvent.builder()
      .eventType(TimelineEventType.TOOL_CALL)
      .metadata(Map.of("tool", "browser_click",
        "arguments", Map.of("element", "Submit Application button")))
      .build());

    assertThat(gateway.get(id).getStatus()).isEqualTo(SessionStatus.PAUSED);
    List<TimelineEvent> events = gateway.timeline(id, null);
    assertThat(events).hasSize(2);
    assertThat(events.get(1).getContent()).isEqualTo(SessionGateway.REVIEW_PAUSE_REASON);
  }

  @Test
  void reviewGateShouldIgnoreOtherClicks() {
    properties.getReviewGate().setEnabled(true);
    String id = runningSession();

    gateway.ingest(id, IngestedEvent.builder()
      .eventType(TimelineEventType.TOOL_CALL)
      .metadata(Map.of("tool", "browser_click", "arguments", Map.of("element", "Next page")))
      .build());

    assertThat(gateway.get(id).getStatus()).isEqualTo(SessionStatus.RUNNING);
  }

  @Test
  void ingestionIntoFinishedSessionShouldBeRejected() {
    String id = runningSession();
    gateway.reportStatus(id, SessionStatus.COMPLETED, null);

    assertThatThrownBy(() -> gateway.ingest(id, toolCall("late")))
      .isInstanceOf(InvalidStateException.class);
    assertThat(gateway.timeline(id, null)).isEmpty();
  }

  @Test
  void agentReportedPauseShouldGoThroughControlPlane() {
    String id = runningSession();

    gateway.reportStatus(id, SessionStatus.PAUSED, "waiting for 2FA code");
    gateway.reportStatus(id, SessionStatus.RUNNING, null);

    assertThat(gateway.timeline(id, null)).extracting(TimelineEvent::getEventType)
      .containsExactly(TimelineEventType.PAUSE, TimelineEventType.RESUME);
  }

  @Test
  void agentCannotIngestPauseOrResumeEvents() {
    String id = runningSession();

    for (TimelineEventType type : List.of(TimelineEventType.PAUSE, TimelineEventType.RESUME)) {
      assertThatThrownBy(() -> gateway.ingest(id, IngestedEvent.builder()
        .eventType(type)
        .content("agent says so")
        .build()))
        .isInstanceOf(IllegalArgumentException.class);
    }

    assertThat(gateway.get(id).getStatus()).isEqualTo(SessionStatus.RUNNING);
    assertThat(gateway.timeline(id, null)).isEmpty();
  }

  @Test
  void ingestionRacingCompletionShouldNeverLandAfterIt() {
    for (int round = 0; round < 30; round++) {
      String id = runningSession();
      AtomicInteger accepted = new AtomicInteger();
      CompletableFuture<Void> agent = CompletableFuture.runAsync(() -> {
        while (true) {
          try {
            gateway.ingest(id, IngestedEvent.builder()
              .eventType(TimelineEventType.THOUGHT)
              .content("thinking " + accepted.get())
              .build());
            accepted.incrementAndGet();
          } catch (InvalidStateException e) {
            return;
          }
        }
      });

      await().atMost(Duration.ofSeconds(5)).until(() -> accepted.get() > 0);
      SessionSnapshot completed = gateway.reportStatus(id, SessionStatus.COMPLETED, null);
      agent.join();

      List<TimelineEvent> events = gateway.timeline(id, null);
      assertThat(events).hasSize(accepted.get());
      assertThat(events).allSatisfy(e ->
        assertThat(e.getTimestamp()).isBeforeOrEqualTo(completed.getCompletedAt()));
    }
  }

  private String runningSession() {
    String id = gateway.create("job", "resume", null).getSessionId();
    gateway.reportStatus(id, SessionStatus.RUNNING, null);
    return id;
  }

  private static IngestedEvent toolCall(String content) {
    return IngestedEvent.builder()
      .eventType(TimelineEventType.TOOL_CALL)
      .content(content)
      .build();
  }
}
