package com.github.spud.sample.ai.iac.domain.rag;

import java.util.Comparator;

/**
 * 检索命中的片段及其分数
 */
public record ScoredSnippet(SnippetRecord snippet, double score) {

  /**
   * 分数降序，同分按 id 升序
   */
  public static final Comparator<ScoredSnippet> RANKING = Comparator
    .comparingDouble(ScoredSnippet::score).reversed()
    .thenComparing(scored -> scored.snippet().id());

  public String id() {
    return snippet.id();
  }
}
