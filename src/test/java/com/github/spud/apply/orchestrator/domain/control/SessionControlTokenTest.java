package com.github.spud.apply.orchestrator.domain.control;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class SessionControlTokenTest {

  @Test
  void freshTokenShouldLetAgentProceed() throws Exception {
    SessionControlToken token = new SessionControlToken("s");

    assertThat(token.isPauseRequested()).isFalse();
    assertThat(token.isCancelled()).isFalse();
    assertThat(token.awaitResume(Duration.ofMillis(10))).isTrue();
    token.whenResumed().block(Duration.ofSeconds(1));
  }

  @Test
  void pausedAgentShouldWaitUntilCleared() throws Exception {
    SessionControlToken token = new SessionControlToken("s");
    token.requestPause();
    assertThat(token.isPauseRequested()).isTrue();
    assertThat(token.awaitResume(Duration.ofMillis(20))).isFalse();

    CompletableFuture<Boolean> waiting = CompletableFuture.supplyAsync(() -> {
      try {
        return token.awaitResume(Duration.ofSeconds(5));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    });
    token.clearPause();

    assertThat(waiting.get(5, TimeUnit.SECONDS)).isTrue();
    assertThat(token.isPauseRequested()).isFalse();
  }

  @Test
  void repeatedPauseShouldKeepSingleGate() {
    SessionControlToken token = new SessionControlToken("s");
    token.requestPause();
    CompletableFuture<Void> resumed = token.whenResumed().toFuture();
    token.requestPause();

    token.clearPause();

    assertThat(resumed).succeedsWithin(Duration.ofSeconds(1));
  }

  @Test
  void cancelShouldReleaseWaitersAndStopAgent() throws Exception {
    SessionControlToken token = new SessionControlToken("s");
    token.requestPause();

    CompletableFuture<Boolean> waiting = CompletableFuture.supplyAsync(() -> {
      try {
        return token.awaitResume(Duration.ofSeconds(5));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return true;
      }
    });
    token.cancel();

    assertThat(waiting.get(5, TimeUnit.SECONDS)).isFalse();
    assertThat(token.isCancelled()).isTrue();
    assertThat(token.isPauseRequested()).isFalse();
  }

  @Test
  void cancellingResumeWaitShouldNotOpenGate() {
    SessionControlToken token = new SessionControlToken("s");
    token.requestPause();

    token.whenResumed().subscribe().dispose();

    assertThat(token.isPauseRequested()).isTrue();
  }
}
