package com.github.spud.sample.ai.iac.domain.rag.scoring;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 从请求文本中提取的检索词：普通关键词 + 识别出的资源类型
 */
public record RequestTerms(SortedSet<String> keywords, SortedSet<String> resourceTypes) {

  private static final RequestTerms EMPTY = of(List.of(), List.of());

  public RequestTerms {
    keywords = Collections.unmodifiableSortedSet(new TreeSet<>(keywords));
    resourceTypes = Collections.unmodifiableSortedSet(new TreeSet<>(resourceTypes));
  }

  public static RequestTerms of(Collection<String> keywords, Collection<String> resourceTypes) {
    return new RequestTerms(new TreeSet<>(keywords), new TreeSet<>(resourceTypes));
  }

  public static RequestTerms empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return keywords.isEmpty() && resourceTypes.isEmpty();
  }

  public int size() {
    return keywords.size() + resourceTypes.size();
  }
}
