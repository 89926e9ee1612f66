package com.github.spud.sample.ai.iac.domain.kernel;

import com.github.spud.sample.ai.iac.domain.rag.ScoredSnippet;
import com.github.spud.sample.ai.iac.domain.validation.Diagnostic;
import java.util.List;

/**
 * 一次生成所用的 prompt 输入
 *
 * @param request             原始请求
 * @param snippets            检索到的片段（按得分降序）
 * @param previousDiagnostics 上一次尝试的诊断，首次尝试为空
 * @param previousCode        上一次尝试的候选代码，首次尝试为 null
 * @param retrievalEnabled    是否启用了检索
 */
public record PromptContext(
  String request,
  List<ScoredSnippet> snippets,
  List<Diagnostic> previousDiagnostics,
  String previousCode,
  boolean retrievalEnabled
) {

  public PromptContext {
    if (request == null || request.isBlank()) {
      throw new IllegalArgumentException("Request must not be blank");
    }
    snippets = snippets != null ? List.copyOf(snippets) : List.of();
    previousDiagnostics = previousDiagnostics != null ? List.copyOf(previousDiagnostics) : List.of();
  }

  public static PromptContext initial(String request, List<ScoredSnippet> snippets,
    boolean retrievalEnabled) {
    return new PromptContext(request, snippets, List.of(), null, retrievalEnabled);
  }

  /**
   * 复用本上下文的请求与片段，附加上一次尝试的代码与诊断
   */
  public PromptContext withFeedback(GenerationAttempt previous) {
    return new PromptContext(request, snippets, previous.outcome().diagnostics(),
      previous.candidateCode(), retrievalEnabled);
  }

  public boolean isRepair() {
    return previousCode != null;
  }
}
