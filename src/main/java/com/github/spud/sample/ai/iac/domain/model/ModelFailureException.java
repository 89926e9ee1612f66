package com.github.spud.sample.ai.iac.domain.model;

/**
 * 模型调用失败（网络、限流、超时、空响应），会话将直接中止，不消耗重试预算
 */
public class ModelFailureException extends RuntimeException {

  public ModelFailureException(String message) {
    super(message);
  }

  public ModelFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
