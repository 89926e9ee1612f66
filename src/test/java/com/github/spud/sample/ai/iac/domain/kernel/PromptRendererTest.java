package com.github.spud.sample.ai.iac.domain.kernel;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.sample.ai.iac.domain.rag.ScoredSnippet;
import com.github.spud.sample.ai.iac.domain.rag.SnippetRecord;
import com.github.spud.sample.ai.iac.domain.validation.Diagnostic;
import com.github.spud.sample.ai.iac.domain.validation.ValidationOutcome;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Prompt 渲染测试
 */
class PromptRendererTest {

  private static final String S3_CONTENT = "resource \"aws_s3_bucket\" \"logs\" {\n  bucket = \"acme-logs\"\n}";

  private final PromptRenderer renderer = new PromptRenderer();

  private static ScoredSnippet scored(String id, String title, String content, double score) {
    return new ScoredSnippet(SnippetRecord.of(id, title, content, List.of(), List.of()), score);
  }

  @Test
  void shouldIncludeRequestAndRankedSnippets() {
    PromptContext context = PromptContext.initial("Create an S3 bucket", List.of(
      scored("s3", "Basic S3 bucket", S3_CONTENT, 0.75),
      scored("vpc", "", "resource \"aws_vpc\" \"main\" {}", 0.25)), true);

    RenderedPrompt prompt = renderer.render(context, 4000);

    assertThat(prompt.system()).isEqualTo(PromptRenderer.SYSTEM_PROMPT);
    assertThat(prompt.user())
      .startsWith("Request:\nCreate an S3 bucket\n\nReference snippets:\n")
      .contains("### Snippet 1: Basic S3 bucket (score 0.75)\n```hcl\n" + S3_CONTENT + "\n```")
      .contains("### Snippet 2: vpc (score 0.25)")
      .endsWith("Return the complete Terraform configuration.")
      .doesNotContain("Previous attempt:");
    assertThat(prompt.user().indexOf("Snippet 1")).isLessThan(prompt.user().indexOf("Snippet 2"));
  }

  @Test
  void shouldSayWhenRetrievalIsDisabled() {
    RenderedPrompt prompt = renderer.render(PromptContext.initial("Create a VPC", List.of(), false), 4000);

    assertThat(prompt.user()).contains(PromptRenderer.NO_SNIPPETS_DISABLED);
  }

  @Test
  void shouldSayWhenNothingWasRetrieved() {
    RenderedPrompt prompt = renderer.render(PromptContext.initial("Create a VPC", List.of(), true), 4000);

    assertThat(prompt.user()).contains(PromptRenderer.NO_SNIPPETS_FOUND);
  }

  @Test
  void zeroBudgetShouldSaySnippetsWereOmitted() {
    PromptContext context = PromptContext.initial("Create an S3 bucket",
      List.of(scored("s3", "Basic S3 bucket", S3_CONTENT, 0.75)), true);

    String user = renderer.render(context, 0).user();

    assertThat(user)
      .contains(PromptRenderer.SNIPPETS_OVER_BUDGET)
      .doesNotContain(PromptRenderer.NO_SNIPPETS_FOUND)
      .doesNotContain("### Snippet");
  }

  @Test
  void shouldTruncateSnippetsBeyondBudget() {
    PromptContext context = PromptContext.initial("Create an S3 bucket", List.of(
      scored("s3", "Basic S3 bucket", S3_CONTENT, 0.75),
      scored("vpc", "VPC", "resource \"aws_vpc\" \"main\" {}", 0.25)), true);

    String user = renderer.render(context, 20).user();

    assertThat(user)
      .contains(S3_CONTENT.substring(0, 20) + PromptRenderer.TRUNCATION_MARKER)
      .doesNotContain("Snippet 2");
  }

  @Test
  void repairPromptShouldCarryPreviousCodeAndDiagnostics() {
    PromptContext base = PromptContext.initial("Create an S3 bucket", List.of(), true);
    String previousCode = "resource \"aws_s3_bucket\" \"logs\" {\n  bucket = \"my-unique-bucket\"\n}";
    GenerationAttempt attempt = new GenerationAttempt(1, base, previousCode,
      ValidationOutcome.of(List.of(Diagnostic.error("Missing or placeholder 'bucket' name in aws_s3_bucket",
        "aws_s3_bucket.logs")), true),
      Instant.now(), 12);

    PromptContext repair = base.withFeedback(attempt);
    String user = renderer.render(repair, 4000).user();

    assertThat(repair.isRepair()).isTrue();
    assertThat(user)
      .contains("Previous attempt:\n```hcl\n" + previousCode + "\n```")
      .contains("- ERROR: Missing or placeholder 'bucket' name in aws_s3_bucket (aws_s3_bucket.logs)")
      .endsWith("Return the complete Terraform configuration.");
  }
}
