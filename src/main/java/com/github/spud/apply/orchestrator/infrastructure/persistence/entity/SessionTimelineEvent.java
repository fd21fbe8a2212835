package com.github.spud.apply.orchestrator.infrastructure.persistence.entity;

import com.github.spud.apply.orchestrator.domain.timeline.TimelineEventType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.NotNull;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Getter
@Setter
@Entity
@Immutable
@Table(name = "session_timeline_event", uniqueConstraints = {
  @UniqueConstraint(name = "session_timeline_event_seq_uk", columnNames = {"session_id", "seq"})
})
public class SessionTimelineEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  @Column(name = "id", nullable = false)
  private UUID id;

  @NotNull
  @Column(name = "session_id", nullable = false, length = 64, updatable = false)
  private String sessionId;

  @NotNull
  @Column(name = "seq", nullable = false, updatable = false)
  private Long seq;

  @NotNull
  @Column(name = "event_type", nullable = false, length = 20, updatable = false)
  @Enumerated(EnumType.STRING)
  private TimelineEventType eventType;

  @NotNull
  @Column(name = "content", nullable = false, length = Integer.MAX_VALUE, updatable = false)
  private String content;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", updatable = false)
  private Map<String, Object> metadata;

  @Column(name = "screenshot_location", length = 2048, updatable = false)
  private String screenshotLocation;

  @NotNull
  @Column(name = "occurred_at", nullable = false, updatable = false)
  private OffsetDateTime occurredAt;

  public SessionTimelineEvent() {
  }
}
