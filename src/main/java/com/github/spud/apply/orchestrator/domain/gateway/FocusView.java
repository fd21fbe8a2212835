package com.github.spud.apply.orchestrator.domain.gateway;

import lombok.Builder;
import lombok.Value;

/**
 * Where an operator should look to watch a session live
 */
@Value
@Builder
public class FocusView {

  String sessionId;

  Integer tabIndex;

  String screenshotLocation;

  /**
   * Remote browser viewer, null when none is configured
   */
  String viewerUrl;
}
