package com.github.spud.sample.ai.iac.infrastructure.config;

import com.github.spud.sample.ai.iac.application.config.RagProperties;
import com.github.spud.sample.ai.iac.domain.rag.KnowledgeBaseHolder;
import com.github.spud.sample.ai.iac.domain.rag.KnowledgeBaseLoader;
import com.github.spud.sample.ai.iac.domain.rag.KnowledgeBaseWriter;
import com.github.spud.sample.ai.iac.domain.rag.Retriever;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * 知识库装配：启动时从 app.rag.kb-file 加载，文件不存在时使用内置示例
 */
@Slf4j
@Configuration
public class KnowledgeBaseConfig {

  @Bean
  public KnowledgeBaseLoader knowledgeBaseLoader() {
    return new KnowledgeBaseLoader();
  }

  @Bean
  public KnowledgeBaseWriter knowledgeBaseWriter() {
    return new KnowledgeBaseWriter();
  }

  @Bean
  public KnowledgeBaseHolder knowledgeBaseHolder(KnowledgeBaseLoader loader, RagProperties ragProperties,
    ResourceLoader resourceLoader) throws IOException {
    KnowledgeBaseLoader.LoadReport report =
      loader.loadOrFallback(resourceLoader.getResource(ragProperties.getKbFile()));
    log.info("Knowledge base ready: {} snippets ({} duplicate ids, {} skipped lines), rag enabled={}",
      report.knowledgeBase().size(), report.duplicateRecords(), report.skippedLines(),
      ragProperties.isEnabled());
    return new KnowledgeBaseHolder(report.knowledgeBase());
  }

  @Bean
  public Retriever retriever(KnowledgeBaseHolder knowledgeBaseHolder) {
    return new Retriever(knowledgeBaseHolder);
  }
}
