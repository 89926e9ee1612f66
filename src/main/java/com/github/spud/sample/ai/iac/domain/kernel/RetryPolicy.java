package com.github.spud.sample.ai.iac.domain.kernel;

import com.github.spud.sample.ai.iac.domain.validation.ValidationOutcome;

/**
 * 重试策略接口 - 根据校验结果与剩余预算决定下一步
 */
public interface RetryPolicy {

  /**
   * @param outcome       本次校验结果
   * @param attemptNumber 本次尝试序号（从 1 开始）
   * @param settings      会话配置
   */
  RetryDecision decide(ValidationOutcome outcome, int attemptNumber, GenerationSettings settings);
}
