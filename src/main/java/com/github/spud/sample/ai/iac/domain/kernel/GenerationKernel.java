package com.github.spud.sample.ai.iac.domain.kernel;

import com.github.spud.sample.ai.iac.domain.model.CodeModel;
import com.github.spud.sample.ai.iac.domain.model.ModelFailureException;
import com.github.spud.sample.ai.iac.domain.rag.RetrievalResult;
import com.github.spud.sample.ai.iac.domain.rag.Retriever;
import com.github.spud.sample.ai.iac.domain.rag.ScoredSnippet;
import com.github.spud.sample.ai.iac.domain.state.GenerationEvent;
import com.github.spud.sample.ai.iac.domain.state.GenerationState;
import com.github.spud.sample.ai.iac.domain.state.StateMachineDriver;
import com.github.spud.sample.ai.iac.domain.validation.ValidationOutcome;
import com.github.spud.sample.ai.iac.domain.validation.Validator;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.statemachine.StateMachine;
import org.springframework.stereotype.Component;

/**
 * 生成会话编排器，驱动状态机完成 生成 → 校验 → 修复 循环
 * <p>
 * 检索只在会话开始时执行一次；取消请求只在开始生成前检查，已生成的草稿仍会被校验并记录
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GenerationKernel {

  private final CodeModel codeModel;
  private final Validator validator;
  private final Retriever retriever;
  private final StateMachineDriver stateMachineDriver;
  private final RetryPolicy retryPolicy;
  private final PromptRenderer promptRenderer;

  /**
   * 执行会话直到终态，结果同时写回会话
   */
  public GenerationResult execute(GenerationSession session) {
    Instant startTime = Instant.now();
    GenerationSettings settings = session.getSettings();
    log.info("Starting generation session: sessionId={}, maxRetries={}, strategy={}, request='{}'",
      session.getSessionId(), settings.maxRetries(), settings.retrievalStrategy(),
      truncate(session.getRequest(), 100));

    StateMachine<GenerationState, GenerationEvent> sm = stateMachineDriver.create(session.getSessionId());
    LoopState loop = new LoopState();
    GenerationResult result;

    try {
      PromptContext baseContext = prepareContext(session);
      fire(sm, GenerationEvent.START);

      // 主循环
      while (!stateMachineDriver.isInFinalState(sm)) {
        GenerationState currentState = stateMachineDriver.getCurrentState(sm);
        session.setState(currentState);

        if (currentState != GenerationState.VALIDATING && session.isCancelled()) {
          log.info("Session {} cancelled in state {}", session.getSessionId(), currentState);
          loop.abortReason = AbortReason.CANCELLED;
          loop.abortMessage = "Cancelled by caller";
          fire(sm, GenerationEvent.CANCEL);
          break;
        }

        switch (currentState) {
          case DRAFTING -> executeDraft(session, baseContext, sm, loop);
          case VALIDATING -> executeValidate(session, sm, loop);
          case RETRYING -> fire(sm, GenerationEvent.RETRY);
          default -> throw new IllegalStateException("Unexpected state " + currentState);
        }
      }

      result = buildResult(session, stateMachineDriver.getCurrentState(sm), loop, startTime);

    } catch (Exception e) {
      log.error("Generation session {} failed: {}", session.getSessionId(), e.getMessage(), e);
      if (!stateMachineDriver.isInFinalState(sm)) {
        stateMachineDriver.sendEvent(sm, GenerationEvent.CANCEL);
      }
      result = GenerationResult.aborted(session, AbortReason.INTERNAL_ERROR, e.getMessage(), startTime);

    } finally {
      stateMachineDriver.stop(sm);
    }

    session.setState(result.getFinalState());
    session.complete(result);
    log.info("Generation session {} finished: outcome={}, attempts={}, bestEffort={}, {}ms",
      session.getSessionId(), result.getOutcome(), session.attemptCount(), result.isBestEffort(),
      result.getTotalDurationMs());
    return result;
  }

  /**
   * 检索一次并缓存到会话
   */
  private PromptContext prepareContext(GenerationSession session) {
    GenerationSettings settings = session.getSettings();
    RetrievalResult retrieval = settings.ragEnabled()
      ? retriever.retrieve(session.getRequest(), settings.topK(), settings.retrievalStrategy())
      : RetrievalResult.empty();
    session.setRetrieval(retrieval);
    log.debug("Session {} retrieved {} snippet(s): {}", session.getSessionId(), retrieval.size(),
      retrieval.items().stream().map(ScoredSnippet::id).toList());
    return PromptContext.initial(session.getRequest(), retrieval.items(), settings.ragEnabled());
  }

  /**
   * 生成阶段：组装 prompt 并调用模型
   */
  private void executeDraft(GenerationSession session, PromptContext baseContext,
    StateMachine<GenerationState, GenerationEvent> sm, LoopState loop) {
    int attemptNumber = session.attemptCount() + 1;
    PromptContext context = session.lastAttempt()
      .map(baseContext::withFeedback)
      .orElse(baseContext);

    log.debug("Session {} attempt {}: DRAFTING", session.getSessionId(), attemptNumber);
    loop.startedAt = Instant.now();
    loop.context = context;

    RenderedPrompt prompt = promptRenderer.render(context, session.getSettings().snippetCharBudget());
    try {
      loop.candidateCode = codeModel.generate(prompt.system(), prompt.user());
    } catch (ModelFailureException e) {
      log.warn("Model failure in session {} attempt {}: {}", session.getSessionId(), attemptNumber,
        e.getMessage());
      loop.abortReason = AbortReason.MODEL_FAILURE;
      loop.abortMessage = e.getMessage();
      fire(sm, GenerationEvent.MODEL_FAILED);
      return;
    }

    log.debug("Candidate code for attempt {}: {}", attemptNumber, truncate(loop.candidateCode, 300));
    fire(sm, GenerationEvent.DRAFT_READY);
  }

  /**
   * 校验阶段：记录尝试并由重试策略决定下一步
   */
  private void executeValidate(GenerationSession session,
    StateMachine<GenerationState, GenerationEvent> sm, LoopState loop) {
    int attemptNumber = session.attemptCount() + 1;
    log.debug("Session {} attempt {}: VALIDATING", session.getSessionId(), attemptNumber);

    ValidationOutcome outcome;
    try {
      outcome = validator.validate(loop.candidateCode);
    } catch (RuntimeException e) {
      log.error("Validator failed unexpectedly: {}", e.getMessage(), e);
      outcome = ValidationOutcome.toolUnavailable(e.getMessage());
    }

    GenerationAttempt attempt = new GenerationAttempt(
      attemptNumber,
      loop.context,
      loop.candidateCode,
      outcome,
      loop.startedAt,
      System.currentTimeMillis() - loop.startedAt.toEpochMilli()
    );
    session.append(attempt);

    RetryDecision decision = retryPolicy.decide(outcome, attemptNumber, session.getSettings());
    log.debug("Attempt {} validated: status={}, diagnostics={}, decision={}", attemptNumber,
      outcome.status(), outcome.diagnostics().size(), decision);

    loop.bestEffort = decision == RetryDecision.ACCEPT_BEST_EFFORT;
    loop.candidateCode = null;
    loop.context = null;
    fire(sm, decision.event());
  }

  /**
   * 发送事件；被拒绝说明流程与状态机定义不一致，直接失败以免空转
   */
  private void fire(StateMachine<GenerationState, GenerationEvent> sm, GenerationEvent event) {
    if (!stateMachineDriver.sendEvent(sm, event)) {
      throw new IllegalStateException(
        "Event " + event + " rejected in state " + stateMachineDriver.getCurrentState(sm));
    }
  }

  private GenerationResult buildResult(GenerationSession session, GenerationState finalState,
    LoopState loop, Instant startTime) {
    return switch (finalState) {
      case SUCCEEDED -> GenerationResult.succeeded(session, loop.bestEffort, startTime);
      case EXHAUSTED -> GenerationResult.exhausted(session, startTime);
      case ABORTED -> GenerationResult.aborted(session,
        loop.abortReason != null ? loop.abortReason : AbortReason.INTERNAL_ERROR,
        loop.abortMessage, startTime);
      default -> GenerationResult.aborted(session, AbortReason.INTERNAL_ERROR,
        "State machine stopped in non-final state " + finalState, startTime);
    };
  }

  private String truncate(String text, int maxLen) {
    if (text == null) {
      return null;
    }
    return text.length() > maxLen ? text.substring(0, maxLen) + "..." : text;
  }

  /**
   * 单个会话循环内的临时数据
   */
  private static final class LoopState {

    private PromptContext context;
    private String candidateCode;
    private Instant startedAt;
    private boolean bestEffort;
    private AbortReason abortReason;
    private String abortMessage;
  }
}
