package com.github.spud.apply.orchestrator.interfaces.rest;

import com.github.spud.apply.orchestrator.domain.broadcast.TimelineSubscription;
import com.github.spud.apply.orchestrator.domain.error.SubscriberOverflowException;
import com.github.spud.apply.orchestrator.domain.gateway.FocusView;
import com.github.spud.apply.orchestrator.domain.gateway.IngestedEvent;
import com.github.spud.apply.orchestrator.domain.gateway.SessionGateway;
import com.github.spud.apply.orchestrator.domain.session.ProgressUpdate;
import com.github.spud.apply.orchestrator.domain.session.SessionSnapshot;
import com.github.spud.apply.orchestrator.domain.session.SessionStatus;
import com.github.spud.apply.orchestrator.domain.timeline.TimelineEvent;
import com.github.spud.apply.orchestrator.domain.timeline.TimelineEventType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Application session Api
 */
@Slf4j
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

  private final SessionGateway sessionGateway;

  @PostMapping
  public Mono<ResponseEntity<SessionSnapshot>> createSession(
    @Valid @RequestBody CreateSessionRequestDto request
  ) {
    return Mono.fromCallable(() -> {
        log.info("Creating session: jobReference={}", request.getJobReference());
        SessionSnapshot created = sessionGateway.create(request.getJobReference(),
          request.getResumeReference(), request.getSessionId());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/batch")
  public Mono<ResponseEntity<List<SessionSnapshot>>> createBatch(
    @Valid @RequestBody CreateBatchRequestDto request
  ) {
    return Mono.fromCallable(() -> {
        log.info("Creating session batch: size={}", request.getJobReferences().size());
        List<SessionSnapshot> created = sessionGateway.createBatch(request.getJobReferences(),
          request.getResumeReference());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping
  public Mono<ResponseEntity<List<SessionSnapshot>>> listSessions(
    @RequestParam(value = "status", required = false) String status
  ) {
    return Mono.fromCallable(() -> ResponseEntity.ok(sessionGateway.list(parseStatus(status))))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/{sessionId}")
  public Mono<ResponseEntity<SessionSnapshot>> getSession(@PathVariable String sessionId) {
    return Mono.fromCallable(() -> ResponseEntity.ok(sessionGateway.get(sessionId)))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/{sessionId}/timeline")
  public Mono<ResponseEntity<List<TimelineEvent>>> getTimeline(
    @PathVariable String sessionId,
    @RequestParam(value = "sinceSequence", required = false) Long sinceSequence
  ) {
    return Mono.fromCallable(
        () -> ResponseEntity.ok(sessionGateway.timeline(sessionId, sinceSequence)))
      .subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * Snapshot then live events as SSE. A client that reconnects with {@code Last-Event-ID}
   * resumes after that sequence.
   */
  @GetMapping(value = "/{sessionId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Mono<ResponseEntity<Flux<ServerSentEvent<Object>>>> streamTimeline(
    @PathVariable String sessionId,
    @RequestParam(value = "sinceSequence", required = false) Long sinceSequence,
    @RequestHeader(value = "Last-Event-ID", required = false) String lastEventId
  ) {
    Long since = sinceSequence != null ? sinceSequence : parseLastEventId(lastEventId);
    return Mono.fromCallable(() -> sessionGateway.subscribe(sessionId, since))
      .subscribeOn(Schedulers.boundedElastic())
      .map(subscription -> ResponseEntity.ok()
        .contentType(MediaType.TEXT_EVENT_STREAM)
        .body(toServerSentEvents(subscription)));
  }

  @PostMapping("/{sessionId}/events")
  public Mono<ResponseEntity<TimelineEvent>> ingestEvent(
    @PathVariable String sessionId,
    @Valid @RequestBody IngestEventRequestDto request
  ) {
    return Mono.fromCallable(() -> {
        IngestedEvent ingested = IngestedEvent.builder()
          .eventType(request.getEventType())
          .content(request.getContent())
          .metadata(request.getMetadata())
          .screenshotLocation(request.getScreenshotLocation())
          .build();
        return ResponseEntity.status(HttpStatus.CREATED)
          .body(sessionGateway.ingest(sessionId, ingested));
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{sessionId}/status")
  public Mono<ResponseEntity<SessionSnapshot>> reportStatus(
    @PathVariable String sessionId,
    @Valid @RequestBody StatusRequestDto request
  ) {
    return Mono.fromCallable(() -> {
        log.info("Agent status report: sessionId={}, status={}", sessionId,
          request.getStatus());
        return ResponseEntity.ok(
          sessionGateway.reportStatus(sessionId, request.getStatus(), request.getDetail()));
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PatchMapping("/{sessionId}/progress")
  public Mono<ResponseEntity<SessionSnapshot>> updateProgress(
    @PathVariable String sessionId,
    @Valid @RequestBody ProgressRequestDto request
  ) {
    return Mono.fromCallable(() -> {
        ProgressUpdate update = ProgressUpdate.builder()
          .currentStep(request.getCurrentStep())
          .currentThought(request.getCurrentThought())
          .screenshotLocation(request.getScreenshotLocation())
          .tabIndex(request.getTabIndex())
          .build();
        return ResponseEntity.ok(sessionGateway.updateProgress(sessionId, update));
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{sessionId}/pause")
  public Mono<ResponseEntity<SessionSnapshot>> pause(
    @PathVariable String sessionId,
    @RequestBody(required = false) ControlRequestDto request
  ) {
    String reason = request != null ? request.getReason() : null;
    return Mono.fromCallable(() -> ResponseEntity.ok(sessionGateway.pause(sessionId, reason)))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{sessionId}/resume")
  public Mono<ResponseEntity<SessionSnapshot>> resume(
    @PathVariable String sessionId,
    @RequestBody(required = false) ControlRequestDto request
  ) {
    String message = request != null ? request.getMessage() : null;
    return Mono.fromCallable(() -> ResponseEntity.ok(sessionGateway.resume(sessionId, message)))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{sessionId}/cancel")
  public Mono<ResponseEntity<SessionSnapshot>> cancel(
    @PathVariable String sessionId,
    @RequestBody(required = false) ControlRequestDto request
  ) {
    String reason = request != null ? request.getReason() : null;
    return Mono.fromCallable(() -> ResponseEntity.ok(sessionGateway.cancel(sessionId, reason)))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/{sessionId}/focus")
  public Mono<ResponseEntity<FocusView>> focus(@PathVariable String sessionId) {
    return Mono.fromCallable(() -> ResponseEntity.ok(sessionGateway.focus(sessionId)))
      .subscribeOn(Schedulers.boundedElastic());
  }

  private Flux<ServerSentEvent<Object>> toServerSentEvents(TimelineSubscription subscription) {
    return subscription.all()
      .map(event -> ServerSentEvent.<Object>builder(event)
        .id(Long.toString(event.getSequence()))
        .event(event.getEventType().getWireName())
        .build())
      .onErrorResume(SubscriberOverflowException.class, e -> {
        log.warn("Stream overflow: sessionId={}, lastDeliveredSequence={}",
          subscription.getSessionId(), e.getLastDeliveredSequence());
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", e.getCode());
        error.put("message", e.getMessage());
        error.put("lastDeliveredSequence", e.getLastDeliveredSequence());
        error.put("timestamp", OffsetDateTime.now());
        return Flux.just(ServerSentEvent.<Object>builder(error).event("error").build());
      });
  }

  private static SessionStatus parseStatus(String status) {
    if (!StringUtils.hasText(status)) {
      return null;
    }
    try {
      return SessionStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown session status: " + status, e);
    }
  }

  private static Long parseLastEventId(String lastEventId) {
    if (!StringUtils.hasText(lastEventId)) {
      return null;
    }
    try {
      return Long.valueOf(lastEventId.trim());
    } catch (NumberFormatException e) {
      log.debug("Ignoring non-numeric Last-Event-ID: {}", lastEventId);
      return null;
    }
  }

  // ===== DTOs =====

  @Data
  public static class CreateSessionRequestDto {

    @NotBlank
    private String jobReference;

    @NotBlank
    private String resumeReference;

    private String sessionId;
  }

  @Data
  public static class CreateBatchRequestDto {

    @NotEmpty
    private List<@NotBlank String> jobReferences;

    @NotBlank
    private String resumeReference;
  }

  @Data
  public static class IngestEventRequestDto {

    @NotNull
    private TimelineEventType eventType;

    private String content;
    private Map<String, Object> metadata;
    private String screenshotLocation;
  }

  @Data
  public static class StatusRequestDto {

    @NotNull
    private SessionStatus status;

    private String detail;
  }

  @Data
  public static class ProgressRequestDto {

    private String currentStep;
    private String currentThought;
    private String screenshotLocation;

    @Min(0)
    private Integer tabIndex;
  }

  @Data
  public static class ControlRequestDto {

    private String reason;
    private String message;
  }
}
