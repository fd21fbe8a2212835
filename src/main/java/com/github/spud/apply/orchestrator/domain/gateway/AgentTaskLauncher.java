package com.github.spud.apply.orchestrator.domain.gateway;

import com.github.spud.apply.orchestrator.domain.control.SessionControlToken;
import com.github.spud.apply.orchestrator.domain.session.SessionSnapshot;

/**
 * Starts the browser agent for a freshly created session.
 * <p>
 * Implementations must return quickly and report progress back through ingestion. The token is
 * the agent's only channel for pause, resume and cancellation.
 */
public interface AgentTaskLauncher {

  /**
   * @throws RuntimeException if the agent could not be started; the session is then failed
   */
  void launch(SessionSnapshot session, SessionControlToken controlToken);
}
