package com.github.spud.sample.ai.iac.domain.state;

import java.util.EnumSet;
import org.springframework.context.annotation.Configuration;
import org.springframework.statemachine.config.EnableStateMachineFactory;
import org.springframework.statemachine.config.EnumStateMachineConfigurerAdapter;
import org.springframework.statemachine.config.builders.StateMachineConfigurationConfigurer;
import org.springframework.statemachine.config.builders.StateMachineStateConfigurer;
import org.springframework.statemachine.config.builders.StateMachineTransitionConfigurer;

/**
 * 生成会话状态机配置
 * <pre>
 * 状态流转:
 *   IDLE --(START)--> DRAFTING
 *   DRAFTING --(DRAFT_READY)--> VALIDATING
 *   DRAFTING --(MODEL_FAILED)--> ABORTED
 *   VALIDATING --(VALIDATION_PASSED)--> SUCCEEDED
 *   VALIDATING --(VALIDATION_FAILED)--> RETRYING
 *   VALIDATING --(BUDGET_EXHAUSTED)--> EXHAUSTED
 *   RETRYING --(RETRY)--> DRAFTING
 *   IDLE / DRAFTING / VALIDATING / RETRYING --(CANCEL)--> ABORTED
 * </pre>
 */
@Configuration
@EnableStateMachineFactory
public class GenerationStateConfig
  extends EnumStateMachineConfigurerAdapter<GenerationState, GenerationEvent> {

  @Override
  public void configure(StateMachineConfigurationConfigurer<GenerationState, GenerationEvent> config)
    throws Exception {
    config
      .withConfiguration()
      .autoStartup(false);
  }

  @Override
  public void configure(StateMachineStateConfigurer<GenerationState, GenerationEvent> states)
    throws Exception {
    defineStates(states);
  }

  @Override
  public void configure(StateMachineTransitionConfigurer<GenerationState, GenerationEvent> transitions)
    throws Exception {
    defineTransitions(transitions);
  }

  /**
   * 状态定义，供 {@code StateMachineBuilder} 复用
   */
  public static void defineStates(StateMachineStateConfigurer<GenerationState, GenerationEvent> states)
    throws Exception {
    states
      .withStates()
      .initial(GenerationState.IDLE)
      .states(EnumSet.allOf(GenerationState.class))
      .end(GenerationState.SUCCEEDED)
      .end(GenerationState.EXHAUSTED)
      .end(GenerationState.ABORTED);
  }

  /**
   * 转换定义，供 {@code StateMachineBuilder} 复用
   */
  public static void defineTransitions(
    StateMachineTransitionConfigurer<GenerationState, GenerationEvent> transitions) throws Exception {
    transitions
      .withExternal()
      .source(GenerationState.IDLE).target(GenerationState.DRAFTING)
      .event(GenerationEvent.START)
      .and()

      // DRAFTING -> VALIDATING / ABORTED
      .withExternal()
      .source(GenerationState.DRAFTING).target(GenerationState.VALIDATING)
      .event(GenerationEvent.DRAFT_READY)
      .and()
      .withExternal()
      .source(GenerationState.DRAFTING).target(GenerationState.ABORTED)
      .event(GenerationEvent.MODEL_FAILED)
      .and()

      // VALIDATING -> 三个出口
      .withExternal()
      .source(GenerationState.VALIDATING).target(GenerationState.SUCCEEDED)
      .event(GenerationEvent.VALIDATION_PASSED)
      .and()
      .withExternal()
      .source(GenerationState.VALIDATING).target(GenerationState.RETRYING)
      .event(GenerationEvent.VALIDATION_FAILED)
      .and()
      .withExternal()
      .source(GenerationState.VALIDATING).target(GenerationState.EXHAUSTED)
      .event(GenerationEvent.BUDGET_EXHAUSTED)
      .and()

      // RETRYING -> DRAFTING (循环)
      .withExternal()
      .source(GenerationState.RETRYING).target(GenerationState.DRAFTING)
      .event(GenerationEvent.RETRY)
      .and()

      // 取消
      .withExternal()
      .source(GenerationState.IDLE).target(GenerationState.ABORTED)
      .event(GenerationEvent.CANCEL)
      .and()
      .withExternal()
      .source(GenerationState.DRAFTING).target(GenerationState.ABORTED)
      .event(GenerationEvent.CANCEL)
      .and()
      .withExternal()
      .source(GenerationState.VALIDATING).target(GenerationState.ABORTED)
      .event(GenerationEvent.CANCEL)
      .and()
      .withExternal()
      .source(GenerationState.RETRYING).target(GenerationState.ABORTED)
      .event(GenerationEvent.CANCEL);
  }
}
