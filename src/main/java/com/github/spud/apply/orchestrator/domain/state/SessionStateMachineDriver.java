package com.github.spud.apply.orchestrator.domain.state;

import com.github.spud.apply.orchestrator.domain.session.SessionStatus;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.config.StateMachineFactory;
import org.springframework.statemachine.support.DefaultStateMachineContext;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Adapter between the session registry and the lifecycle state machine.
 * <p>
 * Sessions are not kept as live machines; each check rehydrates a machine at the stored
 * status and fires the event, so the configured transition table is the only source of truth
 * for legal edges.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionStateMachineDriver {

  private final StateMachineFactory<SessionStatus, SessionTrigger> stateMachineFactory;

  /**
   * Resolve the status reached from {@code current} when moving to {@code target}.
   *
   * @return the new status, or empty when no legal edge exists
   */
  public Optional<SessionStatus> fire(String sessionId, SessionStatus current,
    SessionStatus target) {
    Optional<SessionTrigger> trigger = SessionTrigger.between(current, target);
    if (trigger.isEmpty()) {
      return Optional.empty();
    }

    StateMachine<SessionStatus, SessionTrigger> sm = restore(sessionId, current);
    try {
      if (!sendEvent(sm, trigger.get())) {
        return Optional.empty();
      }
      SessionStatus reached = sm.getState().getId();
      return reached == target ? Optional.of(reached) : Optional.empty();
    } finally {
      sm.stopReactively().block();
    }
  }

  /**
   * Whether {@code current -> target} is an edge of the lifecycle
   */
  public boolean canTransition(String sessionId, SessionStatus current, SessionStatus target) {
    return fire(sessionId, current, target).isPresent();
  }

  private StateMachine<SessionStatus, SessionTrigger> restore(String machineId,
    SessionStatus current) {
    StateMachine<SessionStatus, SessionTrigger> sm = stateMachineFactory.getStateMachine(machineId);
    sm.getStateMachineAccessor().doWithAllRegions(access -> access
      .resetStateMachineReactively(new DefaultStateMachineContext<>(current, null, null, null))
      .block());
    sm.startReactively().block();
    return sm;
  }

  private boolean sendEvent(StateMachine<SessionStatus, SessionTrigger> sm,
    SessionTrigger trigger) {
    StateMachineEventResult<SessionStatus, SessionTrigger> result = sm
      .sendEvent(Mono.just(MessageBuilder.withPayload(trigger).build()))
      .blockFirst();

    boolean accepted = result != null
      && result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED;

    if (!accepted) {
      log.debug("Event {} rejected in state {}", trigger, sm.getState().getId());
    }
    return accepted;
  }
}
