package com.github.spud.apply.orchestrator.domain.state;

import com.github.spud.apply.orchestrator.domain.session.SessionStatus;
import java.util.EnumSet;
import org.springframework.context.annotation.Configuration;
import org.springframework.statemachine.config.EnableStateMachineFactory;
import org.springframework.statemachine.config.EnumStateMachineConfigurerAdapter;
import org.springframework.statemachine.config.builders.StateMachineConfigurationConfigurer;
import org.springframework.statemachine.config.builders.StateMachineStateConfigurer;
import org.springframework.statemachine.config.builders.StateMachineTransitionConfigurer;

/**
 * Session lifecycle state machine
 * <pre>
 * Transitions:
 *   QUEUED  --(START)-->    RUNNING
 *   RUNNING --(PAUSE)-->    PAUSED
 *   PAUSED  --(RESUME)-->   RUNNING
 *   RUNNING --(COMPLETE)--> COMPLETED
 *   QUEUED  --(FAIL)-->     FAILED
 *   RUNNING --(FAIL)-->     FAILED
 *   PAUSED  --(FAIL)-->     FAILED
 * </pre>
 */
@Configuration
@EnableStateMachineFactory
public class SessionStateConfig extends
  EnumStateMachineConfigurerAdapter<SessionStatus, SessionTrigger> {

  @Override
  public void configure(StateMachineConfigurationConfigurer<SessionStatus, SessionTrigger> config)
    throws Exception {
    config
      .withConfiguration()
      .autoStartup(false);
  }

  @Override
  public void configure(StateMachineStateConfigurer<SessionStatus, SessionTrigger> states)
    throws Exception {
    states
      .withStates()
      .initial(SessionStatus.QUEUED)
      .states(EnumSet.allOf(SessionStatus.class))
      .end(SessionStatus.COMPLETED)
      .end(SessionStatus.FAILED);
  }

  @Override
  public void configure(StateMachineTransitionConfigurer<SessionStatus, SessionTrigger> transitions)
    throws Exception {
    transitions
      .withExternal()
      .source(SessionStatus.QUEUED).target(SessionStatus.RUNNING)
      .event(SessionTrigger.START)
      .and()

      .withExternal()
      .source(SessionStatus.RUNNING).target(SessionStatus.PAUSED)
      .event(SessionTrigger.PAUSE)
      .and()

      .withExternal()
      .source(SessionStatus.PAUSED).target(SessionStatus.RUNNING)
      .event(SessionTrigger.RESUME)
      .and()

      .withExternal()
      .source(SessionStatus.RUNNING).target(SessionStatus.COMPLETED)
      .event(SessionTrigger.COMPLETE)
      .and()

      // any pre-terminal status may fail
      .withExternal()
      .source(SessionStatus.QUEUED).target(SessionStatus.FAILED)
      .event(SessionTrigger.FAIL)
      .and()
      .withExternal()
      .source(SessionStatus.RUNNING).target(SessionStatus.FAILED)
      .event(SessionTrigger.FAIL)
      .and()
      .withExternal()
      .source(SessionStatus.PAUSED).target(SessionStatus.FAILED)
      .event(SessionTrigger.FAIL);
  }
}
