package com.github.spud.sample.ai.iac.application.config;

import com.github.spud.sample.ai.iac.domain.rag.scoring.RetrievalStrategy;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 生成会话默认配置，单次请求可覆盖其中一部分
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.iac.generation")
public class GenerationProperties {

  /**
   * 首次尝试之后允许的修复次数
   */
  private int maxRetries = 2;

  /**
   * 每次检索返回的片段数
   */
  private int topK = 3;

  private RetrievalStrategy retrievalStrategy = RetrievalStrategy.KEYWORD;

  /**
   * 校验工具不可用时是否接受通过结构检查的代码
   */
  private boolean bestEffortAcceptance = false;

  /**
   * prompt 中参考片段的总字符数上限
   */
  private int snippetCharBudget = 4000;

  private int maxOutputTokens = 2000;

  private Duration modelTimeout = Duration.ofSeconds(60);

  /**
   * 批量生成时的并发会话数
   */
  private int batchConcurrency = 4;

  /**
   * 保留的已结束会话数量
   */
  private int sessionHistorySize = 200;
}
