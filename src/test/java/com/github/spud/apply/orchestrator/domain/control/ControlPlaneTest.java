package com.github.spud.apply.orchestrator.domain.control;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.apply.orchestrator.domain.error.InvalidStateException;
import com.github.spud.apply.orchestrator.domain.error.SessionNotFoundException;
import com.github.spud.apply.orchestrator.domain.session.SessionRegistry;
import com.github.spud.apply.orchestrator.domain.session.SessionSnapshot;
import com.github.spud.apply.orchestrator.domain.session.SessionStatus;
import com.github.spud.apply.orchestrator.domain.timeline.TimelineEvent;
import com.github.spud.apply.orchestrator.domain.timeline.TimelineEventType;
import com.github.spud.apply.orchestrator.domain.timeline.TimelineStore;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
class ControlPlaneTest {

  @Autowired
  private ControlPlane controlPlane;

  @Autowired
  private SessionRegistry registry;

  @Autowired
  private TimelineStore timelineStore;

  @Test
  void pauseThenResumeShouldRecordOneEventEach() {
    String id = runningSession();

    SessionSnapshot paused = controlPlane.pause(id, "needs CAPTCHA");
    assertThat(paused.getStatus()).isEqualTo(SessionStatus.PAUSED);
    assertThat(registry.get(id).getStatus()).isEqualTo(SessionStatus.PAUSED);

    SessionSnapshot resumed = controlPlane.resume(id, null);
    assertThat(resumed.getStatus()).isEqualTo(SessionStatus.RUNNING);

    List<TimelineEvent> events = timelineStore.list(id);
    assertThat(events).extracting(TimelineEvent::getEventType)
      .containsExactly(TimelineEventType.PAUSE, TimelineEventType.RESUME);
    assertThat(events.get(0).getContent()).isEqualTo("needs CAPTCHA");
    assertThat(events.get(0).getMetadata()).containsEntry("reason", "needs CAPTCHA");
    assertThat(events.get(1).getContent()).isEqualTo("Agent resumed by user");
  }

  @Test
  void pauseShouldSignalTokenAndResumeShouldClearIt() throws Exception {
    String id = runningSession();
    SessionControlToken token = controlPlane.tokenFor(id);

    controlPlane.pause(id, "hold on");
    assertThat(token.isPauseRequested()).isTrue();

    CompletableFuture<Boolean> agent = CompletableFuture.supplyAsync(() -> {
      try {
        return token.awaitResume(Duration.ofSeconds(5));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    });
    controlPlane.resume(id, "go");

    assertThat(agent.get(5, TimeUnit.SECONDS)).isTrue();
    assertThat(token.isPauseRequested()).isFalse();
  }

  @Test
  void pauseOutsideRunningShouldChangeNothing() {
    String queued = registry.create("job", "resume");
    assertThatThrownBy(() -> controlPlane.pause(queued, "too early"))
      .isInstanceOf(InvalidStateException.class);
    assertThat(registry.get(queued).getStatus()).isEqualTo(SessionStatus.QUEUED);
    assertThat(timelineStore.list(queued)).isEmpty();

    String paused = runningSession();
    controlPlane.pause(paused, "first");
    assertThatThrownBy(() -> controlPlane.pause(paused, "second"))
      .isInstanceOf(InvalidStateException.class);
    assertThat(timelineStore.list(paused)).hasSize(1);

    String completed = runningSession();
    registry.transition(completed, SessionStatus.COMPLETED);
    assertThatThrownBy(() -> controlPlane.pause(completed, "late"))
      .isInstanceOf(InvalidStateException.class);
    assertThat(registry.get(completed).getStatus()).isEqualTo(SessionStatus.COMPLETED);
    assertThat(timelineStore.list(completed)).isEmpty();
  }

  @Test
  void resumeOutsidePausedShouldChangeNothing() {
    String id = runningSession();

    assertThatThrownBy(() -> controlPlane.resume(id, null))
      .isInstanceOf(InvalidStateException.class);
    assertThat(registry.get(id).getStatus()).isEqualTo(SessionStatus.RUNNING);
    assertThat(timelineStore.list(id)).isEmpty();
  }

  @Test
  void cancelShouldFailSessionAndStopAgent() {
    String id = registry.create("job", "resume");
    SessionControlToken token = controlPlane.tokenFor(id);

    SessionSnapshot cancelled = controlPlane.cancel(id, "job closed");

    assertThat(cancelled.getStatus()).isEqualTo(SessionStatus.FAILED);
    assertThat(cancelled.getErrorDetail()).isEqualTo("Cancelled: job closed");
    assertThat(cancelled.getCompletedAt()).isNotNull();
    assertThat(token.isCancelled()).isTrue();
    assertThat(controlPlane.findToken(id)).isEmpty();

    assertThat(timelineStore.list(id)).singleElement().satisfies(e -> {
      assertThat(e.getEventType()).isEqualTo(TimelineEventType.ERROR);
      assertThat(e.getContent()).isEqualTo("Cancelled: job closed");
      assertThat(e.getMetadata()).containsEntry("cause", "cancelled");
    });
  }

  @Test
  void cancelShouldWorkFromPaused() {
    String id = runningSession();
    controlPlane.pause(id, "wait");

    assertThat(controlPlane.cancel(id, null).getErrorDetail())
      .isEqualTo("Cancelled: by operator");
  }

  @Test
  void cancelFinishedSessionShouldBeRejected() {
    String id = runningSession();
    registry.transition(id, SessionStatus.COMPLETED);

    assertThatThrownBy(() -> controlPlane.cancel(id, "too late"))
      .isInstanceOf(InvalidStateException.class);
    assertThat(registry.get(id).getStatus()).isEqualTo(SessionStatus.COMPLETED);
  }

  @Test
  void agentCompletionShouldReleaseToken() {
    String id = runningSession();
    SessionControlToken token = controlPlane.tokenFor(id);

    registry.transition(id, SessionStatus.COMPLETED);

    assertThat(token.isCancelled()).isTrue();
    assertThat(controlPlane.findToken(id)).isEmpty();
  }

  @Test
  void agentAttachingAfterPauseShouldSeePause() {
    String id = runningSession();
    assertThat(controlPlane.findToken(id)).isEmpty();

    controlPlane.pause(id, "hold");

    assertThat(controlPlane.tokenFor(id).isPauseRequested()).isTrue();
  }

  @Test
  void unknownSessionShouldRaiseNotFound() {
    assertThatThrownBy(() -> controlPlane.pause("missing", "x"))
      .isInstanceOf(SessionNotFoundException.class);
    assertThatThrownBy(() -> controlPlane.tokenFor("missing"))
      .isInstanceOf(SessionNotFoundException.class);
  }

  private String runningSession() {
    String id = registry.create("job", "resume");
    registry.transition(id, SessionStatus.RUNNING);
    return id;
  }
}
