package com.github.spud.sample.ai.iac.domain.rag;

/**
 * 知识库统计信息
 */
public record KnowledgeBaseStatistics(
  int snippets,
  int keywords,
  int resourceTypes,
  int edges,
  double avgSnippetDegree
) {

}
