package com.github.spud.sample.ai.iac.domain.rag;

import java.util.List;

/**
 * 检索结果：按分数降序排列、长度不超过 topK 的片段序列，按请求计算，不持久化
 */
public record RetrievalResult(List<ScoredSnippet> items) {

  private static final RetrievalResult EMPTY = new RetrievalResult(List.of());

  public RetrievalResult {
    items = List.copyOf(items);
  }

  public static RetrievalResult empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  public int size() {
    return items.size();
  }

  public List<SnippetRecord> snippets() {
    return items.stream().map(ScoredSnippet::snippet).toList();
  }
}
