package com.github.spud.sample.ai.iac.domain.kernel;

import com.github.spud.sample.ai.iac.domain.state.GenerationState;
import com.github.spud.sample.ai.iac.domain.validation.Diagnostic;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * 生成会话的最终结果
 */
@Data
@Builder
public class GenerationResult {

  private String sessionId;

  private String request;

  private GenerationOutcome outcome;

  /**
   * 状态机最终状态
   */
  private GenerationState finalState;

  private boolean success;

  /**
   * 成功时为通过校验的代码；未成功时为最后一次候选代码（可能为 null）
   */
  private String code;

  /**
   * 校验工具不可用时被尽力接受
   */
  private boolean bestEffort;

  /**
   * 最后一次尝试的诊断
   */
  private List<Diagnostic> diagnostics;

  private GenerationAttempt lastAttempt;

  /**
   * 完整的尝试历史
   */
  private List<GenerationAttempt> attempts;

  private AbortReason abortReason;

  /**
   * 中止说明
   */
  private String message;

  private GenerationMetrics metrics;

  private Instant startTime;

  private Instant endTime;

  private long totalDurationMs;

  public static GenerationResult succeeded(GenerationSession session, boolean bestEffort,
    Instant startTime) {
    return base(session, GenerationOutcome.SUCCEEDED, GenerationState.SUCCEEDED, true, startTime)
      .bestEffort(bestEffort)
      .build();
  }

  public static GenerationResult exhausted(GenerationSession session, Instant startTime) {
    return base(session, GenerationOutcome.EXHAUSTED, GenerationState.EXHAUSTED, false, startTime)
      .build();
  }

  public static GenerationResult aborted(GenerationSession session, AbortReason reason,
    String message, Instant startTime) {
    return base(session, GenerationOutcome.ABORTED, GenerationState.ABORTED, false, startTime)
      .abortReason(reason)
      .message(message)
      .build();
  }

  private static GenerationResultBuilder base(GenerationSession session, GenerationOutcome outcome,
    GenerationState finalState, boolean success, Instant startTime) {
    Instant end = Instant.now();
    GenerationAttempt last = session.lastAttempt().orElse(null);
    return GenerationResult.builder()
      .sessionId(session.getSessionId())
      .request(session.getRequest())
      .outcome(outcome)
      .finalState(finalState)
      .success(success)
      .code(last != null ? last.candidateCode() : null)
      .diagnostics(last != null ? last.diagnostics() : List.of())
      .lastAttempt(last)
      .attempts(List.copyOf(session.getAttempts()))
      .metrics(GenerationMetrics.of(session, success))
      .startTime(startTime)
      .endTime(end)
      .totalDurationMs(end.toEpochMilli() - startTime.toEpochMilli());
  }
}
