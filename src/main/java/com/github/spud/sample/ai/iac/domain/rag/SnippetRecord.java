package com.github.spud.sample.ai.iac.domain.rag;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 知识库中的一条可检索片段（只读）
 *
 * @param id            唯一标识
 * @param title         片段标题
 * @param prompt        生成该片段的原始自然语言需求（可能为空串）
 * @param content       Terraform 代码内容
 * @param keywords      小写关键词集合
 * @param resourceTypes 代码中出现的资源类型（如 aws_s3_bucket）
 */
public record SnippetRecord(
  String id,
  String title,
  String prompt,
  String content,
  SortedSet<String> keywords,
  SortedSet<String> resourceTypes
) {

  public SnippetRecord {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Snippet id must not be blank");
    }
    if (content == null || content.isBlank()) {
      throw new IllegalArgumentException("Snippet content must not be blank: id=" + id);
    }
    title = title != null ? title : "";
    prompt = prompt != null ? prompt : "";
    keywords = immutableCopy(keywords);
    resourceTypes = immutableCopy(resourceTypes);
  }

  public static SnippetRecord of(String id, String title, String content,
    Collection<String> keywords, Collection<String> resourceTypes) {
    return new SnippetRecord(id, title, "", content, new TreeSet<>(keywords),
      new TreeSet<>(resourceTypes));
  }

  private static SortedSet<String> immutableCopy(Collection<String> values) {
    if (values == null) {
      return Collections.emptySortedSet();
    }
    return Collections.unmodifiableSortedSet(new TreeSet<>(values));
  }
}
