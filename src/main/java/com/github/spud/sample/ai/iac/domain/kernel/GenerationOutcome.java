package com.github.spud.sample.ai.iac.domain.kernel;

/**
 * 会话终态结果类型
 */
public enum GenerationOutcome {
  SUCCEEDED,
  EXHAUSTED,
  ABORTED
}
