package com.github.spud.sample.ai.iac.domain.rag;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.ai.iac.infrastructure.util.JsonUtils;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.json.JsonParseException;
import org.springframework.core.io.Resource;

/**
 * 从 JSONL 文件加载知识库，每行一条记录
 * <p>
 * 字段：id, content, title, keywords[], resourceTypes[], prompt；同时兼容旧格式字段 snippet_name / iac_code /
 * original_prompt / resource_types。无法解析或缺少内容的行会被跳过并计数，不会中断整个加载
 */
@Slf4j
public class KnowledgeBaseLoader {

  /**
   * 加载结果
   *
   * @param knowledgeBase      构建好的知识库
   * @param loadedRecords      进入知识库的记录数
   * @param duplicateRecords   因 id 重复被丢弃的记录数
   * @param skippedLines       被跳过的畸形行数
   * @param skippedLineNumbers 被跳过的行号（从 1 开始）
   */
  public record LoadReport(
    KnowledgeBase knowledgeBase,
    int loadedRecords,
    int duplicateRecords,
    int skippedLines,
    List<Integer> skippedLineNumbers
  ) {

    public LoadReport {
      skippedLineNumbers = List.copyOf(skippedLineNumbers);
    }
  }

  static final String FALLBACK_SNIPPET_ID = "fallback-ec2";

  /**
   * 资源不存在时退回内置的 EC2 示例片段
   */
  public LoadReport loadOrFallback(Resource resource) throws IOException {
    if (resource == null || !resource.exists()) {
      log.warn("Knowledge base file {} not found, falling back to the built-in EC2 example",
        resource != null ? resource.getDescription() : null);
      return fallback();
    }
    return load(resource);
  }

  public LoadReport fallback() {
    SourceRecord record = new SourceRecord(
      FALLBACK_SNIPPET_ID,
      "Create an EC2 instance",
      """
        resource "aws_instance" "fallback" {
          ami           = "ami-0abcdef1234567890"
          instance_type = "t2.micro"
        }
        """,
      "Fallback EC2 Example",
      List.of("ec2", "instance"),
      List.of("aws_instance")
    );
    return new LoadReport(KnowledgeBase.build(List.of(record)), 1, 0, 0, List.of());
  }

  public LoadReport load(Resource resource) throws IOException {
    log.info("Loading knowledge base from {}", resource.getDescription());
    try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
      return load(reader);
    }
  }

  public LoadReport load(String jsonl) {
    try {
      return load(new StringReader(jsonl));
    } catch (IOException e) {
      throw new IllegalStateException("Unexpected I/O error reading in-memory text", e);
    }
  }

  /**
   * 逐行解析并构建知识库
   *
   * @throws EmptyDatasetException 没有任何有效记录
   */
  public LoadReport load(Reader source) throws IOException {
    List<SourceRecord> records = new ArrayList<>();
    List<Integer> skipped = new ArrayList<>();

    BufferedReader reader = source instanceof BufferedReader buffered
      ? buffered
      : new BufferedReader(source);
    String line;
    int lineNumber = 0;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      SourceRecord record = parseLine(line, lineNumber);
      if (record == null) {
        skipped.add(lineNumber);
      } else {
        records.add(record);
      }
    }

    if (!skipped.isEmpty()) {
      log.warn("Skipped {} malformed knowledge base line(s): {}", skipped.size(), skipped);
    }

    KnowledgeBase knowledgeBase = KnowledgeBase.build(records);
    int duplicates = records.size() - knowledgeBase.size();
    if (duplicates > 0) {
      log.warn("Dropped {} knowledge base record(s) with duplicate ids", duplicates);
    }
    return new LoadReport(knowledgeBase, knowledgeBase.size(), duplicates, skipped.size(), skipped);
  }

  private SourceRecord parseLine(String line, int lineNumber) {
    JsonNode node;
    try {
      node = JsonUtils.readTree(line);
    } catch (JsonParseException e) {
      log.debug("Line {} is not valid JSON: {}", lineNumber, e.getMessage());
      return null;
    }
    if (node == null || !node.isObject()) {
      log.debug("Line {} is not a JSON object", lineNumber);
      return null;
    }

    String content = text(node, "content", "iac_code");
    if (content == null || content.isBlank()) {
      log.debug("Line {} has no content", lineNumber);
      return null;
    }

    String id = text(node, "id", "snippet_id");
    if (id == null || id.isBlank()) {
      id = String.valueOf(lineNumber);
    }

    return new SourceRecord(
      id,
      text(node, "prompt", "original_prompt"),
      content,
      text(node, "title", "snippet_name"),
      list(node, "keywords", "keywords"),
      list(node, "resourceTypes", "resource_types")
    );
  }

  private static String text(JsonNode node, String field, String legacyField) {
    JsonNode value = node.hasNonNull(field) ? node.get(field) : node.get(legacyField);
    if (value == null || value.isNull() || value.isContainerNode()) {
      return null;
    }
    return value.asText();
  }

  private static List<String> list(JsonNode node, String field, String legacyField) {
    JsonNode value = node.hasNonNull(field) ? node.get(field) : node.get(legacyField);
    List<String> values = new ArrayList<>();
    if (value == null || value.isNull()) {
      return values;
    }
    if (value.isArray()) {
      value.forEach(item -> {
        if (item.isValueNode() && !item.asText().isBlank()) {
          values.add(item.asText());
        }
      });
    } else if (value.isTextual()) {
      // 兼容逗号分隔的关键词字符串
      Arrays.stream(value.asText().split(","))
        .map(String::trim)
        .filter(item -> !item.isEmpty())
        .forEach(values::add);
    }
    return values;
  }
}
