package com.github.spud.sample.ai.iac.domain.kernel;

import com.github.spud.sample.ai.iac.domain.validation.ValidationOutcome;
import org.springframework.stereotype.Component;

/**
 * 默认重试策略实现
 */
@Component
public class DefaultRetryPolicy implements RetryPolicy {

  @Override
  public RetryDecision decide(ValidationOutcome outcome, int attemptNumber, GenerationSettings settings) {
    // 1. 校验通过
    if (outcome.isValid()) {
      return RetryDecision.ACCEPT;
    }

    // 2. 工具不可用：仅在结构检查通过且允许时尽力接受
    if (outcome.isToolUnavailable() && outcome.structuralChecksPassed()
      && settings.bestEffortAcceptance()) {
      return RetryDecision.ACCEPT_BEST_EFFORT;
    }

    // 3. 其余按未通过处理
    return attemptNumber <= settings.maxRetries() ? RetryDecision.RETRY : RetryDecision.EXHAUSTED;
  }
}
