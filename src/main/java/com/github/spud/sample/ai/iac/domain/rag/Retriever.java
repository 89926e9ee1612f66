package com.github.spud.sample.ai.iac.domain.rag;

import com.github.spud.sample.ai.iac.domain.rag.scoring.RetrievalStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 检索器：按配置的策略对当前知识库排序并截取 topK
 */
@Slf4j
@RequiredArgsConstructor
public class Retriever {

  public static final int DEFAULT_TOP_K = 3;

  private final KnowledgeBaseHolder knowledgeBaseHolder;

  /**
   * 关键词策略，取前 {@value #DEFAULT_TOP_K} 条
   */
  public RetrievalResult retrieve(String request) {
    return retrieve(request, DEFAULT_TOP_K, RetrievalStrategy.KEYWORD);
  }

  /**
   * 检索相关片段
   *
   * @param request  请求文本，空文本返回空结果
   * @param topK     最多返回条数
   * @param strategy 打分策略
   */
  public RetrievalResult retrieve(String request, int topK, RetrievalStrategy strategy) {
    KnowledgeBase knowledgeBase = knowledgeBaseHolder.get();
    long start = System.currentTimeMillis();

    RetrievalResult result = knowledgeBase.query(request, topK, strategy);

    log.debug("Retrieved {} snippet(s) from {} with strategy={}, topK={} in {}ms",
      result.size(), knowledgeBase.size(), strategy, topK, System.currentTimeMillis() - start);
    return result;
  }

  public KnowledgeBase knowledgeBase() {
    return knowledgeBaseHolder.get();
  }
}
