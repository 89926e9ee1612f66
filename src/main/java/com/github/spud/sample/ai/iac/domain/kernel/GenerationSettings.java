package com.github.spud.sample.ai.iac.domain.kernel;

import com.github.spud.sample.ai.iac.application.config.GenerationProperties;
import com.github.spud.sample.ai.iac.application.config.RagProperties;
import com.github.spud.sample.ai.iac.domain.rag.scoring.RetrievalStrategy;

/**
 * 一个会话最终生效的配置（全局默认值 + 请求覆盖项）
 *
 * @param maxRetries           首次尝试之后的最大修复次数
 * @param topK                 检索片段数
 * @param retrievalStrategy    检索打分策略
 * @param bestEffortAcceptance 校验工具不可用时是否接受结构检查通过的代码
 * @param ragEnabled           是否检索参考片段
 * @param snippetCharBudget    prompt 中参考片段的字符预算
 */
public record GenerationSettings(
  int maxRetries,
  int topK,
  RetrievalStrategy retrievalStrategy,
  boolean bestEffortAcceptance,
  boolean ragEnabled,
  int snippetCharBudget
) {

  /**
   * 单个会话允许的最大修复次数
   */
  public static final int MAX_RETRIES_LIMIT = 10;

  /**
   * 单次检索允许的最大片段数
   */
  public static final int MAX_TOP_K = 20;

  public GenerationSettings {
    if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
      throw new InvalidGenerationOptionsException(
        "maxRetries must be between 0 and " + MAX_RETRIES_LIMIT + ": " + maxRetries);
    }
    if (topK < 1 || topK > MAX_TOP_K) {
      throw new InvalidGenerationOptionsException(
        "topK must be between 1 and " + MAX_TOP_K + ": " + topK);
    }
    if (snippetCharBudget < 0) {
      throw new InvalidGenerationOptionsException(
        "snippetCharBudget must not be negative: " + snippetCharBudget);
    }
    if (retrievalStrategy == null) {
      retrievalStrategy = RetrievalStrategy.KEYWORD;
    }
  }

  /**
   * 合并请求覆盖项与全局配置
   *
   * @throws InvalidGenerationOptionsException 合并后的值不合法
   */
  public static GenerationSettings resolve(GenerationOptions options, GenerationProperties defaults,
    RagProperties ragProperties) {
    GenerationOptions overrides = options != null ? options : GenerationOptions.defaults();
    return new GenerationSettings(
      overrides.getMaxRetries() != null ? overrides.getMaxRetries() : defaults.getMaxRetries(),
      overrides.getTopK() != null ? overrides.getTopK() : defaults.getTopK(),
      overrides.getRetrievalStrategy() != null
        ? overrides.getRetrievalStrategy()
        : defaults.getRetrievalStrategy(),
      overrides.getBestEffortAcceptance() != null
        ? overrides.getBestEffortAcceptance()
        : defaults.isBestEffortAcceptance(),
      overrides.getRagEnabled() != null ? overrides.getRagEnabled() : ragProperties.isEnabled(),
      defaults.getSnippetCharBudget()
    );
  }

  /**
   * 最多允许的尝试次数
   */
  public int maxAttempts() {
    return maxRetries + 1;
  }
}
