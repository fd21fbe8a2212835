package com.github.spud.apply.orchestrator.infrastructure.persistence.entity;

import com.github.spud.apply.orchestrator.domain.session.SessionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;

/**
 * One automated application attempt. {@code job_reference} and {@code resume_reference} point
 * into external catalogs and are not foreign keys.
 */
@Getter
@Setter
@Entity
@Table(name = "application_session", indexes = {
  @Index(name = "application_session_status_idx", columnList = "status")
})
public class ApplicationSession {

  @Id
  @Size(max = 64)
  @Column(name = "session_id", nullable = false, length = 64)
  private String sessionId;

  @NotNull
  @Column(name = "job_reference", nullable = false, length = 2048)
  private String jobReference;

  @NotNull
  @Size(max = 255)
  @Column(name = "resume_reference", nullable = false)
  private String resumeReference;

  @NotNull
  @ColumnDefault("'QUEUED'")
  @Column(name = "status", nullable = false, length = 20)
  @Enumerated(EnumType.STRING)
  private SessionStatus status = SessionStatus.QUEUED;

  @Column(name = "current_step", length = Integer.MAX_VALUE)
  private String currentStep;

  @Column(name = "current_thought", length = Integer.MAX_VALUE)
  private String currentThought;

  @Column(name = "screenshot_location", length = 2048)
  private String screenshotLocation;

  @Column(name = "screenshot_dir", length = 2048)
  private String screenshotDir;

  @Column(name = "tab_index")
  private Integer tabIndex;

  @Column(name = "error_detail", length = Integer.MAX_VALUE)
  private String errorDetail;

  @NotNull
  @Column(name = "created_at", nullable = false)
  private OffsetDateTime createdAt;

  @NotNull
  @Column(name = "updated_at", nullable = false)
  private OffsetDateTime updatedAt;

  @Column(name = "completed_at")
  private OffsetDateTime completedAt;

}
