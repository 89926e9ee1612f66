package com.github.spud.sample.ai.iac.domain.kernel;

import com.github.spud.sample.ai.iac.domain.state.GenerationEvent;

/**
 * 一次校验之后的决定
 */
public enum RetryDecision {
  ACCEPT(GenerationEvent.VALIDATION_PASSED),
  ACCEPT_BEST_EFFORT(GenerationEvent.VALIDATION_PASSED),
  RETRY(GenerationEvent.VALIDATION_FAILED),
  EXHAUSTED(GenerationEvent.BUDGET_EXHAUSTED);

  private final GenerationEvent event;

  RetryDecision(GenerationEvent event) {
    this.event = event;
  }

  /**
   * 对应的状态机事件
   */
  public GenerationEvent event() {
    return event;
  }
}
