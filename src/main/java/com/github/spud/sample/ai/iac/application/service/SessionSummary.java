package com.github.spud.sample.ai.iac.application.service;

import com.github.spud.sample.ai.iac.domain.kernel.GenerationResult;
import com.github.spud.sample.ai.iac.domain.kernel.GenerationSession;
import java.time.Instant;
import lombok.Data;

/**
 * 会话摘要
 */
@Data
public class SessionSummary {

  private String sessionId;
  private String request;
  private String state;
  private boolean finished;
  private boolean cancelRequested;
  private Boolean success;
  private String outcome;
  private int attempts;
  private Instant createdAt;
  private Long totalDurationMs;

  public static SessionSummary fromSession(GenerationSession session) {
    SessionSummary summary = new SessionSummary();
    summary.setSessionId(session.getSessionId());
    summary.setRequest(session.getRequest());
    summary.setState(session.getState().name());
    summary.setFinished(session.isFinished());
    summary.setCancelRequested(session.isCancelled());
    summary.setAttempts(session.attemptCount());
    summary.setCreatedAt(session.getCreatedAt());

    GenerationResult result = session.getResult();
    if (result != null) {
      summary.setSuccess(result.isSuccess());
      summary.setOutcome(result.getOutcome().name());
      summary.setTotalDurationMs(result.getTotalDurationMs());
    }
    return summary;
  }
}
