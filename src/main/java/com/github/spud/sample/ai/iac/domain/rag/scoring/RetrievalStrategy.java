package com.github.spud.sample.ai.iac.domain.rag.scoring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.github.spud.sample.ai.iac.domain.rag.SnippetGraph;
import java.util.Locale;

/**
 * 检索打分策略（由配置选择）
 */
public enum RetrievalStrategy {

  /**
   * 关键词/资源类型重叠
   */
  KEYWORD {
    @Override
    public SnippetScorer createScorer(SnippetGraph graph) {
      return new KeywordSnippetScorer();
    }
  },

  /**
   * 片段-关键词-资源图的一跳可达度
   */
  GRAPH {
    @Override
    public SnippetScorer createScorer(SnippetGraph graph) {
      return new GraphSnippetScorer(graph);
    }
  };

  public abstract SnippetScorer createScorer(SnippetGraph graph);

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static RetrievalStrategy fromValue(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    for (RetrievalStrategy strategy : values()) {
      if (strategy.name().equalsIgnoreCase(value.trim())) {
        return strategy;
      }
    }
    throw new IllegalArgumentException("Unknown retrieval strategy: " + value);
  }
}
