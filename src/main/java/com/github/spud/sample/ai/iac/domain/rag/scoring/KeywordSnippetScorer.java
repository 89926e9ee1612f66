package com.github.spud.sample.ai.iac.domain.rag.scoring;

import com.github.spud.sample.ai.iac.domain.rag.SnippetRecord;

/**
 * 关键词重叠打分
 * <p>
 * 请求词与片段 keywords ∪ resourceTypes 的重叠度，资源类型精确命中的权重高于普通关键词，按可达到的最大权重归一化
 */
public class KeywordSnippetScorer implements SnippetScorer {

  static final double RESOURCE_WEIGHT = 2.0;
  static final double KEYWORD_WEIGHT = 1.0;

  @Override
  public double score(RequestTerms request, SnippetRecord snippet) {
    double attainable = RESOURCE_WEIGHT * request.resourceTypes().size()
      + KEYWORD_WEIGHT * request.keywords().size();
    if (attainable == 0) {
      return 0.0;
    }

    long resourceHits = request.resourceTypes().stream()
      .filter(snippet.resourceTypes()::contains)
      .count();
    long keywordHits = request.keywords().stream()
      .filter(term -> snippet.keywords().contains(term) || snippet.resourceTypes().contains(term))
      .count();

    double score = (RESOURCE_WEIGHT * resourceHits + KEYWORD_WEIGHT * keywordHits) / attainable;
    return Math.min(1.0, score);
  }
}
