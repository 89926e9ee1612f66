package com.github.spud.sample.ai.iac.domain.rag;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 片段-关键词-资源类型 无向图
 * <pre>
 *   s:{id} ── k:{keyword}
 *          └─ r:{resourceType}
 * </pre>
 * 构建后只读，可被并发读取
 */
public final class SnippetGraph {

  private final Map<String, Set<String>> adjacency;
  private final int edgeCount;

  private SnippetGraph(Map<String, Set<String>> adjacency, int edgeCount) {
    this.adjacency = adjacency;
    this.edgeCount = edgeCount;
  }

  public static SnippetGraph of(Collection<SnippetRecord> snippets) {
    Map<String, Set<String>> mutable = new HashMap<>();
    int edges = 0;
    for (SnippetRecord snippet : snippets) {
      String snippetNode = snippetNode(snippet.id());
      mutable.computeIfAbsent(snippetNode, k -> new TreeSet<>());
      for (String keyword : snippet.keywords()) {
        edges += connect(mutable, snippetNode, keywordNode(keyword));
      }
      for (String resource : snippet.resourceTypes()) {
        edges += connect(mutable, snippetNode, resourceNode(resource));
      }
    }

    Map<String, Set<String>> frozen = new HashMap<>();
    mutable.forEach((node, neighbors) -> frozen.put(node, Collections.unmodifiableSet(neighbors)));
    return new SnippetGraph(Collections.unmodifiableMap(frozen), edges);
  }

  private static int connect(Map<String, Set<String>> graph, String a, String b) {
    boolean added = graph.computeIfAbsent(a, k -> new TreeSet<>()).add(b);
    graph.computeIfAbsent(b, k -> new TreeSet<>()).add(a);
    return added ? 1 : 0;
  }

  public static String snippetNode(String snippetId) {
    return "s:" + snippetId;
  }

  public static String keywordNode(String keyword) {
    return "k:" + keyword;
  }

  public static String resourceNode(String resourceType) {
    return "r:" + resourceType;
  }

  public boolean contains(String node) {
    return adjacency.containsKey(node);
  }

  public Set<String> neighbors(String node) {
    return adjacency.getOrDefault(node, Set.of());
  }

  public int degree(String node) {
    return neighbors(node).size();
  }

  public int nodeCount() {
    return adjacency.size();
  }

  public int edgeCount() {
    return edgeCount;
  }
}
