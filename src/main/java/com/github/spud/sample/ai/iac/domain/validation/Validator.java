package com.github.spud.sample.ai.iac.domain.validation;

/**
 * 候选代码校验器
 * <p>
 * 实现不得向调用方抛出校验相关异常：外部工具失败应体现为 {@link ValidationStatus#TOOL_UNAVAILABLE}
 */
public interface Validator {

  ValidationOutcome validate(String candidateCode);
}
