package com.github.spud.sample.ai.iac.domain.kernel;

import com.github.spud.sample.ai.iac.domain.validation.Diagnostic;
import com.github.spud.sample.ai.iac.domain.validation.ValidationOutcome;
import java.time.Instant;
import java.util.List;

/**
 * 一次完整的“生成 + 校验”，记录后不可修改
 *
 * @param attemptNumber 从 1 开始的序号
 * @param promptContext 本次使用的 prompt 输入
 * @param candidateCode 模型返回的候选代码
 * @param outcome       校验结果
 * @param startedAt     开始时间
 * @param durationMs    生成与校验总耗时
 */
public record GenerationAttempt(
  int attemptNumber,
  PromptContext promptContext,
  String candidateCode,
  ValidationOutcome outcome,
  Instant startedAt,
  long durationMs
) {

  public GenerationAttempt {
    if (attemptNumber < 1) {
      throw new IllegalArgumentException("attemptNumber is 1-based: " + attemptNumber);
    }
    if (promptContext == null || outcome == null) {
      throw new IllegalArgumentException("Attempt requires a prompt context and an outcome");
    }
    candidateCode = candidateCode != null ? candidateCode : "";
  }

  public List<Diagnostic> diagnostics() {
    return outcome.diagnostics();
  }
}
