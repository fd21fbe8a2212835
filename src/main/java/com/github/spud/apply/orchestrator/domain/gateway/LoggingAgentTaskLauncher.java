package com.github.spud.apply.orchestrator.domain.gateway;

import com.github.spud.apply.orchestrator.domain.control.SessionControlToken;
import com.github.spud.apply.orchestrator.domain.session.SessionSnapshot;
import lombok.extern.slf4j.Slf4j;

/**
 * Launcher used when agents run out of process and attach through the ingestion API.
 */
@Slf4j
public class LoggingAgentTaskLauncher implements AgentTaskLauncher {

  @Override
  public void launch(SessionSnapshot session, SessionControlToken controlToken) {
    log.info("Session awaiting external agent: sessionId={}, jobReference={}, screenshotDir={}",
      session.getSessionId(), session.getJobReference(), session.getScreenshotDir());
  }
}
