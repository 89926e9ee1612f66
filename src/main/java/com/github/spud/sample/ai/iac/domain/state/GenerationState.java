package com.github.spud.sample.ai.iac.domain.state;

/**
 * 生成会话状态
 * <pre>
 * IDLE → DRAFTING → VALIDATING → SUCCEEDED
 *                              → RETRYING → DRAFTING (循环)
 *                              → EXHAUSTED
 *        任意非终态 → ABORTED
 * </pre>
 */
public enum GenerationState {
  /**
   * 已创建，尚未开始
   */
  IDLE,

  /**
   * 组装 prompt 并调用模型生成候选代码
   */
  DRAFTING,

  /**
   * 校验候选代码
   */
  VALIDATING,

  /**
   * 校验未通过且仍有重试预算，准备下一次生成
   */
  RETRYING,

  /**
   * 成功（终态）
   */
  SUCCEEDED,

  /**
   * 重试预算耗尽（终态）
   */
  EXHAUSTED,

  /**
   * 模型失败或被取消（终态）
   */
  ABORTED;

  /**
   * 是否为终态
   */
  public static boolean isFinal(GenerationState state) {
    return state == SUCCEEDED || state == EXHAUSTED || state == ABORTED;
  }
}
