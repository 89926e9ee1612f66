package com.github.spud.sample.ai.iac.domain.kernel;

/**
 * 会话中止原因
 */
public enum AbortReason {
  /**
   * 模型调用失败或超时
   */
  MODEL_FAILURE,

  /**
   * 调用方取消
   */
  CANCELLED,

  /**
   * 未预期的内部错误
   */
  INTERNAL_ERROR
}
