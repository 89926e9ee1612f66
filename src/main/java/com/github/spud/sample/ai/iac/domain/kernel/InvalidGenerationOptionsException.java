package com.github.spud.sample.ai.iac.domain.kernel;

/**
 * 生成配置不合法（负的重试次数、topK 小于 1 等）
 */
public class InvalidGenerationOptionsException extends IllegalArgumentException {

  public InvalidGenerationOptionsException(String message) {
    super(message);
  }
}
