package com.github.spud.sample.ai.iac.domain.rag.scoring;

import com.github.spud.sample.ai.iac.domain.rag.SnippetRecord;

/**
 * 片段相关性打分策略
 */
public interface SnippetScorer {

  /**
   * 计算片段与请求的相关性
   *
   * @param request 请求检索词
   * @param snippet 候选片段
   * @return [0, 1] 区间内的分数，0 表示不相关
   */
  double score(RequestTerms request, SnippetRecord snippet);
}
