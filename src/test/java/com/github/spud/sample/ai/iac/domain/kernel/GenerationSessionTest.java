package com.github.spud.sample.ai.iac.domain.kernel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.sample.ai.iac.application.config.GenerationProperties;
import com.github.spud.sample.ai.iac.application.config.RagProperties;
import com.github.spud.sample.ai.iac.domain.rag.scoring.RetrievalStrategy;
import com.github.spud.sample.ai.iac.domain.validation.ValidationOutcome;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * 会话与配置合并测试
 */
class GenerationSessionTest {

  private GenerationSettings settings;
  private GenerationSession session;

  @BeforeEach
  void setUp() {
    settings = new GenerationSettings(1, 3, RetrievalStrategy.KEYWORD, false, true, 4000);
    session = new GenerationSession("Create a VPC", settings);
  }

  private GenerationAttempt attempt(int number) {
    return new GenerationAttempt(number, PromptContext.initial("Create a VPC", List.of(), true),
      "resource \"aws_vpc\" \"main\" {}", ValidationOutcome.valid(), Instant.now(), 5);
  }

  @Test
  void shouldAppendAttemptsInOrder() {
    session.append(attempt(1));
    session.append(attempt(2));

    assertThat(session.attemptCount()).isEqualTo(2);
    assertThat(session.lastAttempt()).get().extracting(GenerationAttempt::attemptNumber).isEqualTo(2);
    assertThatThrownBy(() -> session.getAttempts().add(attempt(3)))
      .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void shouldRejectOutOfOrderAttempt() {
    assertThatThrownBy(() -> session.append(attempt(2)))
      .isInstanceOf(IllegalStateException.class)
      .hasMessageContaining("out of order");
  }

  @Test
  void shouldRejectAttemptsBeyondBudget() {
    session.append(attempt(1));
    session.append(attempt(2));

    assertThatThrownBy(() -> session.append(attempt(3)))
      .isInstanceOf(IllegalStateException.class)
      .hasMessageContaining("budget");
  }

  @Test
  void cancelShouldBeRefusedOnceFinished() {
    assertThat(session.cancel()).isTrue();
    assertThat(session.isCancelled()).isTrue();

    GenerationSession finished = new GenerationSession("Create a VPC", settings);
    finished.complete(GenerationResult.exhausted(finished, Instant.now()));

    assertThat(finished.cancel()).isFalse();
    assertThat(finished.isCancelled()).isFalse();
  }

  @Test
  void shouldRejectBlankRequest() {
    assertThatThrownBy(() -> new GenerationSession(" ", settings))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void requestOptionsShouldOverrideDefaults() {
    GenerationProperties defaults = new GenerationProperties();
    RagProperties rag = new RagProperties();
    GenerationOptions options = GenerationOptions.builder()
      .maxRetries(0)
      .retrievalStrategy(RetrievalStrategy.GRAPH)
      .ragEnabled(false)
      .build();

    GenerationSettings resolved = GenerationSettings.resolve(options, defaults, rag);

    assertThat(resolved.maxRetries()).isZero();
    assertThat(resolved.maxAttempts()).isEqualTo(1);
    assertThat(resolved.topK()).isEqualTo(defaults.getTopK());
    assertThat(resolved.retrievalStrategy()).isEqualTo(RetrievalStrategy.GRAPH);
    assertThat(resolved.ragEnabled()).isFalse();
    assertThat(resolved.bestEffortAcceptance()).isFalse();
  }

  @Test
  void invalidOptionsShouldBeRejected() {
    GenerationProperties defaults = new GenerationProperties();
    RagProperties rag = new RagProperties();

    assertThatThrownBy(() -> GenerationSettings.resolve(
      GenerationOptions.builder().maxRetries(-1).build(), defaults, rag))
      .isInstanceOf(InvalidGenerationOptionsException.class);
    assertThatThrownBy(() -> GenerationSettings.resolve(
      GenerationOptions.builder().topK(0).build(), defaults, rag))
      .isInstanceOf(InvalidGenerationOptionsException.class);
  }

  @Test
  void retryAndTopKCeilingsShouldBeEnforced() {
    assertThatThrownBy(() -> new GenerationSettings(Integer.MAX_VALUE, 3, RetrievalStrategy.KEYWORD,
      false, true, 4000))
      .isInstanceOf(InvalidGenerationOptionsException.class)
      .hasMessageContaining("maxRetries");
    assertThatThrownBy(() -> new GenerationSettings(1, GenerationSettings.MAX_TOP_K + 1,
      RetrievalStrategy.KEYWORD, false, true, 4000))
      .isInstanceOf(InvalidGenerationOptionsException.class)
      .hasMessageContaining("topK");

    GenerationSettings ceiling = new GenerationSettings(GenerationSettings.MAX_RETRIES_LIMIT, 3,
      RetrievalStrategy.KEYWORD, false, true, 4000);
    assertThat(ceiling.maxAttempts()).isEqualTo(GenerationSettings.MAX_RETRIES_LIMIT + 1);
  }
}
