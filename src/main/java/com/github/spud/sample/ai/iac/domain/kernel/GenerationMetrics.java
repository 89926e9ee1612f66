package com.github.spud.sample.ai.iac.domain.kernel;

/**
 * 会话统计
 *
 * @param totalAttempts        尝试总数
 * @param attemptsUntilSuccess 成功时的尝试序号，未成功为 null
 * @param ragUsed              prompt 中是否带有检索片段
 * @param snippetsRetrieved    检索到的片段数
 */
public record GenerationMetrics(
  int totalAttempts,
  Integer attemptsUntilSuccess,
  boolean ragUsed,
  int snippetsRetrieved
) {

  static GenerationMetrics of(GenerationSession session, boolean success) {
    int total = session.attemptCount();
    int retrieved = session.getRetrieval() != null ? session.getRetrieval().size() : 0;
    return new GenerationMetrics(
      total,
      success && total > 0 ? total : null,
      session.getSettings().ragEnabled() && retrieved > 0,
      retrieved
    );
  }
}
