package com.github.spud.sample.ai.iac.domain.rag.scoring;

import com.github.spud.sample.ai.iac.domain.rag.SnippetGraph;
import com.github.spud.sample.ai.iac.domain.rag.SnippetRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 图结构打分
 * <p>
 * 请求词映射为关键词/资源节点，片段得分为其一跳邻居中命中的请求节点权重之和，权重为 1/度数（抑制泛化的枢纽词）， 再按全部请求节点的权重之和归一化。
 * 通过资源节点，两个没有字面关键词重叠的片段也能因共享资源类型而被召回
 */
public class GraphSnippetScorer implements SnippetScorer {

  private final SnippetGraph graph;

  public GraphSnippetScorer(SnippetGraph graph) {
    this.graph = graph;
  }

  @Override
  public double score(RequestTerms request, SnippetRecord snippet) {
    List<String> requestNodes = requestNodes(request);
    if (requestNodes.isEmpty()) {
      return 0.0;
    }

    Set<String> neighbors = graph.neighbors(SnippetGraph.snippetNode(snippet.id()));
    double total = 0.0;
    double matched = 0.0;
    for (String node : requestNodes) {
      double weight = weight(node);
      total += weight;
      if (neighbors.contains(node)) {
        matched += weight;
      }
    }
    return total == 0 ? 0.0 : Math.min(1.0, matched / total);
  }

  private double weight(String node) {
    int degree = graph.degree(node);
    // 图中不存在的词按 1 计，任何片段都无法命中
    return degree == 0 ? 1.0 : 1.0 / degree;
  }

  private List<String> requestNodes(RequestTerms request) {
    List<String> nodes = new ArrayList<>(request.size());
    request.keywords().forEach(keyword -> nodes.add(SnippetGraph.keywordNode(keyword)));
    request.resourceTypes().forEach(type -> nodes.add(SnippetGraph.resourceNode(type)));
    return nodes;
  }
}
