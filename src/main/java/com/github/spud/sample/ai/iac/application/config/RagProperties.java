package com.github.spud.sample.ai.iac.application.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * RAG 配置属性
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.rag")
public class RagProperties {

  /**
   * 是否启用 RAG
   */
  private boolean enabled = true;

  /**
   * 知识库 JSONL 文件位置（Spring Resource 路径）
   */
  private String kbFile = "classpath:rag_kb.jsonl";
}
