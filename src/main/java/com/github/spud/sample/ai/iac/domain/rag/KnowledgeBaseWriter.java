package com.github.spud.sample.ai.iac.domain.rag;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.sample.ai.iac.infrastructure.util.JsonUtils;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * 将知识库持久化为 JSONL（每行一条记录），与 {@link KnowledgeBaseLoader} 的读取格式一致
 */
@Slf4j
public class KnowledgeBaseWriter {

  public void write(KnowledgeBase knowledgeBase, Path target) throws IOException {
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
      write(knowledgeBase, writer);
    }
    log.info("Wrote {} snippets to {}", knowledgeBase.size(), target);
  }

  public void write(KnowledgeBase knowledgeBase, Writer writer) throws IOException {
    for (SnippetRecord snippet : knowledgeBase.snippets()) {
      writer.write(toLine(snippet));
      writer.write('\n');
    }
    writer.flush();
  }

  String toLine(SnippetRecord snippet) {
    ObjectNode node = JsonUtils.objectMapper().createObjectNode();
    node.put("id", snippet.id());
    node.put("title", snippet.title());
    node.put("prompt", snippet.prompt());
    node.put("content", snippet.content());
    ArrayNode keywords = node.putArray("keywords");
    snippet.keywords().forEach(keywords::add);
    ArrayNode resourceTypes = node.putArray("resourceTypes");
    snippet.resourceTypes().forEach(resourceTypes::add);
    return JsonUtils.toJson(node);
  }
}
