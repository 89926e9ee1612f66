package com.github.spud.sample.ai.iac.domain.state;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.config.StateMachineFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * 状态机驱动器 - GenerationKernel 与 StateMachine 的适配层
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StateMachineDriver {

  private final StateMachineFactory<GenerationState, GenerationEvent> stateMachineFactory;

  /**
   * 为新的会话创建并启动状态机实例
   */
  public StateMachine<GenerationState, GenerationEvent> create(String machineId) {
    StateMachine<GenerationState, GenerationEvent> sm = stateMachineFactory.getStateMachine(machineId);
    sm.startReactively().block();
    return sm;
  }

  public GenerationState getCurrentState(StateMachine<GenerationState, GenerationEvent> sm) {
    return sm.getState().getId();
  }

  /**
   * 发送事件并等待状态转换完成
   *
   * @return 事件是否被接受
   */
  public boolean sendEvent(StateMachine<GenerationState, GenerationEvent> sm, GenerationEvent event) {
    log.debug("Sending event {} to state machine {}, current state: {}", event, sm.getId(),
      getCurrentState(sm));

    StateMachineEventResult<GenerationState, GenerationEvent> result = sm
      .sendEvent(Mono.just(MessageBuilder.withPayload(event).build()))
      .blockFirst();

    boolean accepted = result != null
      && result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED;

    if (accepted) {
      log.debug("Event {} accepted, new state: {}", event, getCurrentState(sm));
    } else {
      log.warn("Event {} rejected in state {}", event, getCurrentState(sm));
    }
    return accepted;
  }

  public void stop(StateMachine<GenerationState, GenerationEvent> sm) {
    sm.stopReactively().block();
  }

  public boolean isInFinalState(StateMachine<GenerationState, GenerationEvent> sm) {
    return GenerationState.isFinal(getCurrentState(sm));
  }
}
