package com.github.spud.sample.ai.iac.domain.kernel;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.github.spud.sample.ai.iac.domain.rag.scoring.RetrievalStrategy;
import com.github.spud.sample.ai.iac.domain.state.GenerationEvent;
import com.github.spud.sample.ai.iac.domain.validation.Diagnostic;
import com.github.spud.sample.ai.iac.domain.validation.ValidationOutcome;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * 重试策略单元测试
 */
class DefaultRetryPolicyTest {

  private final DefaultRetryPolicy policy = new DefaultRetryPolicy();

  private static GenerationSettings settings(int maxRetries, boolean bestEffort) {
    return new GenerationSettings(maxRetries, 3, RetrievalStrategy.KEYWORD, bestEffort, true, 4000);
  }

  private static ValidationOutcome invalid() {
    return ValidationOutcome.of(List.of(Diagnostic.error("Unsupported argument", "main.tf:4")), true);
  }

  @Test
  void shouldAcceptValidOutcome() {
    RetryDecision decision = policy.decide(ValidationOutcome.valid(), 3, settings(2, false));

    assertEquals(RetryDecision.ACCEPT, decision);
    assertEquals(GenerationEvent.VALIDATION_PASSED, decision.event());
  }

  @Test
  void shouldRetryWhileBudgetRemains() {
    assertEquals(RetryDecision.RETRY, policy.decide(invalid(), 1, settings(2, false)));
    assertEquals(RetryDecision.RETRY, policy.decide(invalid(), 2, settings(2, false)));
  }

  @Test
  void shouldExhaustAfterLastAllowedAttempt() {
    RetryDecision decision = policy.decide(invalid(), 3, settings(2, false));

    assertEquals(RetryDecision.EXHAUSTED, decision);
    assertEquals(GenerationEvent.BUDGET_EXHAUSTED, decision.event());
  }

  @Test
  void zeroRetriesShouldAllowSingleAttempt() {
    assertEquals(RetryDecision.EXHAUSTED, policy.decide(invalid(), 1, settings(0, false)));
  }

  @Test
  void toolUnavailableShouldBeAcceptedOnlyWhenAllowed() {
    ValidationOutcome unavailable = ValidationOutcome.toolUnavailable("terraform not found");

    assertEquals(RetryDecision.ACCEPT_BEST_EFFORT, policy.decide(unavailable, 1, settings(2, true)));
    assertEquals(RetryDecision.RETRY, policy.decide(unavailable, 1, settings(2, false)));
  }
}
