package com.github.spud.sample.ai.iac.domain.state;

import java.util.UUID;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.config.StateMachineBuilder;
import org.springframework.statemachine.config.StateMachineFactory;

/**
 * 不依赖 Spring 容器的状态机工厂，转换定义与生产配置一致
 */
public class TestStateMachineFactory implements StateMachineFactory<GenerationState, GenerationEvent> {

  public static StateMachine<GenerationState, GenerationEvent> build(String machineId) {
    StateMachineBuilder.Builder<GenerationState, GenerationEvent> builder = StateMachineBuilder.builder();
    try {
      builder.configureConfiguration()
        .withConfiguration()
        .machineId(machineId)
        .autoStartup(false);
      GenerationStateConfig.defineStates(builder.configureStates());
      GenerationStateConfig.defineTransitions(builder.configureTransitions());
    } catch (Exception e) {
      throw new IllegalStateException("Failed to build state machine", e);
    }
    return builder.build();
  }

  @Override
  public StateMachine<GenerationState, GenerationEvent> getStateMachine() {
    return build(UUID.randomUUID().toString());
  }

  @Override
  public StateMachine<GenerationState, GenerationEvent> getStateMachine(String machineId) {
    return build(machineId);
  }

  @Override
  public StateMachine<GenerationState, GenerationEvent> getStateMachine(UUID uuid) {
    return build(uuid.toString());
  }
}
