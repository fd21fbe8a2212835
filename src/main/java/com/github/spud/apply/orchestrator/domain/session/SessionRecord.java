package com.github.spud.apply.orchestrator.domain.session;

import com.github.spud.apply.orchestrator.infrastructure.persistence.entity.ApplicationSession;
import java.time.OffsetDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registry-side copy of a session row (maps to application_session table).
 * Only mutated by {@link SessionRegistry} under the session's shard lock.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SessionRecord {

  private String sessionId;
  private String jobReference;
  private String resumeReference;
  private SessionStatus status;
  private String currentStep;
  private String currentThought;
  private String screenshotLocation;
  private String screenshotDir;
  private Integer tabIndex;
  private String errorDetail;
  private OffsetDateTime createdAt;
  private OffsetDateTime updatedAt;
  private OffsetDateTime completedAt;

  public ApplicationSession toEntity() {
    ApplicationSession entity = new ApplicationSession();
    entity.setSessionId(this.sessionId);
    entity.setJobReference(this.jobReference);
    entity.setResumeReference(this.resumeReference);
    entity.setStatus(this.status);
    entity.setCurrentStep(this.currentStep);
    entity.setCurrentThought(this.currentThought);
    entity.setScreenshotLocation(this.screenshotLocation);
    entity.setScreenshotDir(this.screenshotDir);
    entity.setTabIndex(this.tabIndex);
    entity.setErrorDetail(this.errorDetail);
    entity.setCreatedAt(this.createdAt);
    entity.setUpdatedAt(this.updatedAt);
    entity.setCompletedAt(this.completedAt);
    return entity;
  }

  public static SessionRecord fromEntity(ApplicationSession entity) {
    return SessionRecord.builder()
      .sessionId(entity.getSessionId())
      .jobReference(entity.getJobReference())
      .resumeReference(entity.getResumeReference())
      .status(entity.getStatus())
      .currentStep(entity.getCurrentStep())
      .currentThought(entity.getCurrentThought())
      .screenshotLocation(entity.getScreenshotLocation())
      .screenshotDir(entity.getScreenshotDir())
      .tabIndex(entity.getTabIndex())
      .errorDetail(entity.getErrorDetail())
      .createdAt(entity.getCreatedAt())
      .updatedAt(entity.getUpdatedAt())
      .completedAt(entity.getCompletedAt())
      .build();
  }

  public SessionSnapshot toSnapshot() {
    return SessionSnapshot.builder()
      .sessionId(sessionId)
      .jobReference(jobReference)
      .resumeReference(resumeReference)
      .status(status)
      .currentStep(currentStep)
      .currentThought(currentThought)
      .screenshotLocation(screenshotLocation)
      .screenshotDir(screenshotDir)
      .tabIndex(tabIndex)
      .errorDetail(errorDetail)
      .createdAt(createdAt)
      .updatedAt(updatedAt)
      .completedAt(completedAt)
      .build();
  }
}
