package com.github.spud.apply.orchestrator.domain.session;

import lombok.Builder;
import lombok.Value;

/**
 * Partial overwrite of a session's progress fields. Null fields are left untouched.
 */
@Value
@Builder
public class ProgressUpdate {

  String currentStep;
  String currentThought;
  String screenshotLocation;
  Integer tabIndex;

  public boolean isEmpty() {
    return currentStep == null && currentThought == null && screenshotLocation == null
      && tabIndex == null;
  }
}
