package com.github.spud.sample.ai.iac.domain.kernel;

import com.github.spud.sample.ai.iac.domain.rag.ScoredSnippet;
import com.github.spud.sample.ai.iac.domain.validation.Diagnostic;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * 将 {@link PromptContext} 渲染为模型输入文本（纯函数，不调用模型）
 * <p>
 * 参考片段按得分降序写入，总长度受字符预算限制，超出预算的片段被截断或省略；修复轮次附带上一次的代码与诊断
 */
@Component
public class PromptRenderer {

  static final String SYSTEM_PROMPT = """
    You are an expert in Terraform and AWS infrastructure.
    Given a natural language request, and possibly some reference Terraform snippets,
    generate the corresponding Terraform HCL code for AWS.
    Include the necessary provider block and every required argument.
    Produce only the HCL code, without explanations.
    """;

  static final String NO_SNIPPETS_DISABLED = "No RAG snippets provided.";
  static final String NO_SNIPPETS_FOUND = "No relevant reference snippets were found.";
  static final String SNIPPETS_OVER_BUDGET =
    "Reference snippets were retrieved but omitted to stay within the prompt budget.";
  static final String TRUNCATION_MARKER = "\n# ... (truncated)";

  public RenderedPrompt render(PromptContext context, int snippetCharBudget) {
    StringBuilder user = new StringBuilder();
    user.append("Request:\n").append(context.request().trim()).append("\n\n");

    user.append("Reference snippets:\n");
    appendSnippets(user, context, snippetCharBudget);

    if (context.isRepair()) {
      user.append("\nPrevious attempt:\n```hcl\n")
        .append(context.previousCode())
        .append("\n```\n\n");
      appendCorrections(user, context);
    }

    user.append("\nReturn the complete Terraform configuration.");
    return new RenderedPrompt(SYSTEM_PROMPT, user.toString());
  }

  private void appendSnippets(StringBuilder out, PromptContext context, int budget) {
    if (!context.retrievalEnabled()) {
      out.append(NO_SNIPPETS_DISABLED).append('\n');
      return;
    }
    if (context.snippets().isEmpty()) {
      out.append(NO_SNIPPETS_FOUND).append('\n');
      return;
    }

    int remaining = budget;
    int index = 0;
    for (ScoredSnippet scored : context.snippets()) {
      if (remaining <= 0) {
        break;
      }
      String content = scored.snippet().content();
      if (content.length() > remaining) {
        content = content.substring(0, remaining) + TRUNCATION_MARKER;
        remaining = 0;
      } else {
        remaining -= content.length();
      }

      index++;
      out.append("### Snippet ").append(index).append(": ").append(titleOf(scored))
        .append(" (score ").append(String.format(Locale.ROOT, "%.2f", scored.score())).append(")\n")
        .append("```hcl\n").append(content).append("\n```\n");
    }
    if (index == 0) {
      out.append(SNIPPETS_OVER_BUDGET).append('\n');
    }
  }

  private void appendCorrections(StringBuilder out, PromptContext context) {
    if (context.previousDiagnostics().isEmpty()) {
      out.append("The previous attempt was rejected. Review it and provide a corrected version.\n");
      return;
    }
    out.append("The previous attempt failed validation. Fix every problem listed below")
      .append(" and keep the parts that were correct:\n");
    for (Diagnostic diagnostic : context.previousDiagnostics()) {
      out.append("- ").append(diagnostic.render()).append('\n');
    }
  }

  private static String titleOf(ScoredSnippet scored) {
    String title = scored.snippet().title();
    return title == null || title.isBlank() ? scored.id() : title;
  }
}
