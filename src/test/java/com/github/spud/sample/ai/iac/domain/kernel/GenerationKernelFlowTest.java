package com.github.spud.sample.ai.iac.domain.kernel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.sample.ai.iac.domain.model.CodeModel;
import com.github.spud.sample.ai.iac.domain.model.ModelFailureException;
import com.github.spud.sample.ai.iac.domain.rag.RetrievalResult;
import com.github.spud.sample.ai.iac.domain.rag.Retriever;
import com.github.spud.sample.ai.iac.domain.rag.ScoredSnippet;
import com.github.spud.sample.ai.iac.domain.rag.SnippetRecord;
import com.github.spud.sample.ai.iac.domain.rag.scoring.RetrievalStrategy;
import com.github.spud.sample.ai.iac.domain.state.GenerationState;
import com.github.spud.sample.ai.iac.domain.state.StateMachineDriver;
import com.github.spud.sample.ai.iac.domain.state.TestStateMachineFactory;
import com.github.spud.sample.ai.iac.domain.validation.Diagnostic;
import com.github.spud.sample.ai.iac.domain.validation.HeuristicValidator;
import com.github.spud.sample.ai.iac.domain.validation.Severity;
import com.github.spud.sample.ai.iac.domain.validation.ValidationOutcome;
import com.github.spud.sample.ai.iac.domain.validation.Validator;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * GenerationKernel 流程测试：真实状态机，模型/校验/检索为桩
 */
@ExtendWith(MockitoExtension.class)
class GenerationKernelFlowTest {

  private static final String VALID_EC2 = """
    resource "aws_instance" "web" {
      ami           = "ami-0c02fb55956c7d316"
      instance_type = "t2.micro"
    }""";

  private static final String PLACEHOLDER_S3 = """
    resource "aws_s3_bucket" "logs" {
      bucket = "my-unique-bucket"
    }""";

  private static final String FIXED_S3 = """
    resource "aws_s3_bucket" "logs" {
      bucket = "acme-logs-2024"
    }""";

  @Mock
  private CodeModel codeModel;

  @Mock
  private Validator validator;

  @Mock
  private Retriever retriever;

  private GenerationKernel kernel;

  @BeforeEach
  void setUp() {
    kernel = new GenerationKernel(
      codeModel,
      validator,
      retriever,
      new StateMachineDriver(new TestStateMachineFactory()),
      new DefaultRetryPolicy(),
      new PromptRenderer()
    );

    SnippetRecord snippet = SnippetRecord.of("s3-basic", "Basic S3 bucket", FIXED_S3,
      List.of("s3", "bucket"), List.of("aws_s3_bucket"));
    lenient().when(retriever.retrieve(anyString(), anyInt(), any()))
      .thenReturn(new RetrievalResult(List.of(new ScoredSnippet(snippet, 0.75))));
  }

  private static GenerationSession session(String request, int maxRetries, boolean bestEffort,
    boolean ragEnabled) {
    return new GenerationSession(request,
      new GenerationSettings(maxRetries, 3, RetrievalStrategy.KEYWORD, bestEffort, ragEnabled, 4000));
  }

  private static ValidationOutcome invalid(String message) {
    return ValidationOutcome.of(List.of(Diagnostic.error(message, "main.tf:1")), true);
  }

  @Test
  void shouldSucceedOnFirstValidDraft() {
    when(codeModel.generate(anyString(), anyString())).thenReturn(VALID_EC2);
    when(validator.validate(VALID_EC2)).thenReturn(ValidationOutcome.valid());
    GenerationSession session = session("Create an EC2 instance", 2, false, true);

    GenerationResult result = kernel.execute(session);

    assertThat(result.getOutcome()).isEqualTo(GenerationOutcome.SUCCEEDED);
    assertThat(result.getFinalState()).isEqualTo(GenerationState.SUCCEEDED);
    assertThat(result.isSuccess()).isTrue();
    assertThat(result.isBestEffort()).isFalse();
    assertThat(result.getCode()).isEqualTo(VALID_EC2);
    assertThat(result.getAttempts()).hasSize(1);
    assertThat(result.getMetrics().attemptsUntilSuccess()).isEqualTo(1);
    assertThat(result.getMetrics().ragUsed()).isTrue();
    assertThat(session.isFinished()).isTrue();
    assertThat(session.getState()).isEqualTo(GenerationState.SUCCEEDED);
  }

  @Test
  void shouldExhaustAfterMaxRetriesPlusOneAttempts() {
    when(codeModel.generate(anyString(), anyString())).thenReturn("resource \"aws_vpc\" \"x\" {}");
    when(validator.validate(anyString())).thenReturn(invalid("Missing required argument"));
    GenerationSession session = session("Create a VPC", 2, false, true);

    GenerationResult result = kernel.execute(session);

    assertThat(result.getOutcome()).isEqualTo(GenerationOutcome.EXHAUSTED);
    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getAttempts()).extracting(GenerationAttempt::attemptNumber).containsExactly(1, 2, 3);
    assertThat(result.getDiagnostics()).extracting(Diagnostic::message)
      .containsExactly("Missing required argument");
    assertThat(result.getMetrics().attemptsUntilSuccess()).isNull();
    verify(codeModel, times(3)).generate(anyString(), anyString());
    // 检索只执行一次，重试复用
    verify(retriever, times(1)).retrieve(anyString(), anyInt(), any());
  }

  @Test
  void shouldFeedDiagnosticsIntoRepairPrompt() {
    when(codeModel.generate(anyString(), anyString())).thenReturn(PLACEHOLDER_S3, FIXED_S3);
    GenerationKernel heuristicKernel = new GenerationKernel(codeModel, new HeuristicValidator(), retriever,
      new StateMachineDriver(new TestStateMachineFactory()), new DefaultRetryPolicy(), new PromptRenderer());
    GenerationSession session = session("Create an S3 bucket for logs", 2, false, true);

    GenerationResult result = heuristicKernel.execute(session);

    ArgumentCaptor<String> userPrompts = ArgumentCaptor.forClass(String.class);
    verify(codeModel, times(2)).generate(anyString(), userPrompts.capture());
    String firstPrompt = userPrompts.getAllValues().get(0);
    String secondPrompt = userPrompts.getAllValues().get(1);

    assertThat(firstPrompt).contains("### Snippet 1: Basic S3 bucket").doesNotContain("Previous attempt:");
    assertThat(secondPrompt)
      .contains("Previous attempt:")
      .contains(PLACEHOLDER_S3)
      .contains("- ERROR: Missing or placeholder 'bucket' name in aws_s3_bucket (aws_s3_bucket.logs)")
      .contains("### Snippet 1: Basic S3 bucket");

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getCode()).isEqualTo(FIXED_S3);
    assertThat(result.getMetrics().attemptsUntilSuccess()).isEqualTo(2);
    assertThat(result.getAttempts().get(1).promptContext().isRepair()).isTrue();
  }

  @Test
  void modelTimeoutShouldAbortWithoutAttempts() {
    when(codeModel.generate(anyString(), anyString()))
      .thenThrow(new ModelFailureException("Model call timed out after 60s"));
    GenerationSession session = session("Create an EC2 instance", 2, false, true);

    GenerationResult result = kernel.execute(session);

    assertThat(result.getOutcome()).isEqualTo(GenerationOutcome.ABORTED);
    assertThat(result.getAbortReason()).isEqualTo(AbortReason.MODEL_FAILURE);
    assertThat(result.getMessage()).contains("timed out");
    assertThat(result.getAttempts()).isEmpty();
    assertThat(result.getCode()).isNull();
    verify(validator, never()).validate(anyString());
  }

  @Test
  void cancelBeforeStartShouldAbortWithoutCallingModel() {
    GenerationSession session = session("Create an EC2 instance", 2, false, true);
    session.cancel();

    GenerationResult result = kernel.execute(session);

    assertThat(result.getOutcome()).isEqualTo(GenerationOutcome.ABORTED);
    assertThat(result.getAbortReason()).isEqualTo(AbortReason.CANCELLED);
    verify(codeModel, never()).generate(anyString(), anyString());
  }

  @Test
  void cancelDuringAttemptShouldStopBeforeNextAttempt() {
    GenerationSession session = session("Create a VPC", 3, false, true);
    when(codeModel.generate(anyString(), anyString())).thenAnswer(invocation -> {
      session.cancel();
      return "resource \"aws_vpc\" \"x\" {}";
    });
    when(validator.validate(anyString())).thenReturn(invalid("Missing required argument"));

    GenerationResult result = kernel.execute(session);

    assertThat(result.getAbortReason()).isEqualTo(AbortReason.CANCELLED);
    assertThat(result.getAttempts()).hasSize(1);
    assertThat(result.getCode()).isEqualTo("resource \"aws_vpc\" \"x\" {}");
    verify(codeModel, times(1)).generate(anyString(), anyString());
  }

  @Test
  void draftFinishedAfterCancelShouldStillBeValidated() {
    GenerationSession session = session("Create an EC2 instance", 2, false, true);
    when(codeModel.generate(anyString(), anyString())).thenAnswer(invocation -> {
      session.cancel();
      return VALID_EC2;
    });
    when(validator.validate(VALID_EC2)).thenReturn(ValidationOutcome.valid());

    GenerationResult result = kernel.execute(session);

    assertThat(result.getOutcome()).isEqualTo(GenerationOutcome.SUCCEEDED);
    assertThat(result.getAttempts()).hasSize(1);
    assertThat(result.getCode()).isEqualTo(VALID_EC2);
    verify(validator, times(1)).validate(VALID_EC2);
  }

  @Test
  void unavailableValidatorShouldBeAcceptedWhenBestEffortAllowed() {
    when(codeModel.generate(anyString(), anyString())).thenReturn(VALID_EC2);
    when(validator.validate(anyString())).thenReturn(ValidationOutcome.toolUnavailable("terraform not found"));

    GenerationResult result = kernel.execute(session("Create an EC2 instance", 2, true, true));

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.isBestEffort()).isTrue();
    assertThat(result.getDiagnostics()).extracting(Diagnostic::severity).containsExactly(Severity.WARNING);
  }

  @Test
  void unavailableValidatorShouldNotCountAsSuccessByDefault() {
    when(codeModel.generate(anyString(), anyString())).thenReturn(VALID_EC2);
    when(validator.validate(anyString())).thenReturn(ValidationOutcome.toolUnavailable("terraform not found"));

    GenerationResult result = kernel.execute(session("Create an EC2 instance", 0, false, true));

    assertThat(result.getOutcome()).isEqualTo(GenerationOutcome.EXHAUSTED);
    assertThat(result.isSuccess()).isFalse();
  }

  @Test
  void validatorCrashShouldBeTreatedAsToolUnavailable() {
    when(codeModel.generate(anyString(), anyString())).thenReturn(VALID_EC2);
    when(validator.validate(anyString())).thenThrow(new IllegalStateException("disk full"));

    GenerationResult result = kernel.execute(session("Create an EC2 instance", 0, true, true));

    assertThat(result.isBestEffort()).isTrue();
    assertThat(result.getDiagnostics().get(0).message()).contains("disk full");
  }

  @Test
  void disabledRetrievalShouldSkipKnowledgeBase() {
    when(codeModel.generate(anyString(), anyString())).thenReturn(VALID_EC2);
    when(validator.validate(anyString())).thenReturn(ValidationOutcome.valid());

    GenerationResult result = kernel.execute(session("Create an EC2 instance", 2, false, false));

    ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);
    verify(codeModel).generate(anyString(), userPrompt.capture());
    assertThat(userPrompt.getValue()).contains(PromptRenderer.NO_SNIPPETS_DISABLED);
    assertThat(result.getMetrics().ragUsed()).isFalse();
    verify(retriever, never()).retrieve(anyString(), anyInt(), any());
  }
}
