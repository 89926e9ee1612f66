package com.github.spud.sample.ai.iac.domain.validation;

/**
 * 校验结论
 */
public enum ValidationStatus {
  /**
   * 没有 ERROR 级别诊断
   */
  VALID,

  /**
   * 存在 ERROR 级别诊断（结构检查或 Terraform 校验失败）
   */
  INVALID,

  /**
   * 外部校验工具不可用或超时，降级信号
   */
  TOOL_UNAVAILABLE
}
