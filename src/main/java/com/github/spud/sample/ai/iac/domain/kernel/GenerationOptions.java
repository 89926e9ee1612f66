package com.github.spud.sample.ai.iac.domain.kernel;

import com.github.spud.sample.ai.iac.domain.rag.scoring.RetrievalStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单次请求的可选覆盖项，为 null 的字段使用全局默认值
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationOptions {

  private Integer maxRetries;

  private Integer topK;

  private RetrievalStrategy retrievalStrategy;

  private Boolean bestEffortAcceptance;

  /**
   * 是否使用知识库检索
   */
  private Boolean ragEnabled;

  public static GenerationOptions defaults() {
    return new GenerationOptions();
  }
}
