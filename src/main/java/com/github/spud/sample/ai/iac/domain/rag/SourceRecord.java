package com.github.spud.sample.ai.iac.domain.rag;

import java.util.List;

/**
 * 构建知识库的原始数据条目，附带外部预先生成的标题/关键词元数据
 * <p>
 * title、keywords、resourceTypes 均可为空，构建时会按默认规则补全
 */
public record SourceRecord(
  String id,
  String prompt,
  String content,
  String title,
  List<String> keywords,
  List<String> resourceTypes
) {

  public SourceRecord {
    keywords = keywords != null ? List.copyOf(keywords) : List.of();
    resourceTypes = resourceTypes != null ? List.copyOf(resourceTypes) : List.of();
  }

  public boolean isUsable() {
    return content != null && !content.isBlank();
  }
}
