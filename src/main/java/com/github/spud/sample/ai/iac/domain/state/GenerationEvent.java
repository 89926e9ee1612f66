package com.github.spud.sample.ai.iac.domain.state;

/**
 * 生成会话状态机事件
 */
public enum GenerationEvent {
  /**
   * 启动会话
   */
  START,

  /**
   * 模型返回了候选代码
   */
  DRAFT_READY,

  /**
   * 校验通过（或尽力接受）
   */
  VALIDATION_PASSED,

  /**
   * 校验未通过，仍有重试预算
   */
  VALIDATION_FAILED,

  /**
   * 校验未通过，重试预算耗尽
   */
  BUDGET_EXHAUSTED,

  /**
   * 开始下一次生成
   */
  RETRY,

  /**
   * 模型调用失败
   */
  MODEL_FAILED,

  /**
   * 调用方取消
   */
  CANCEL
}
