package com.github.spud.sample.ai.iac.domain.rag;

import com.github.spud.sample.ai.iac.domain.rag.scoring.RequestTerms;
import com.github.spud.sample.ai.iac.domain.rag.scoring.RetrievalStrategy;
import com.github.spud.sample.ai.iac.domain.rag.scoring.SnippetScorer;
import com.github.spud.sample.ai.iac.domain.rag.scoring.TermExtractor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;

/**
 * 内存知识库
 * <p>
 * 一次性从数据集构建，构建后只读（片段、关系图与打分器均在构建时生成），可被多个会话并发共享而无需加锁
 */
@Slf4j
public final class KnowledgeBase {

  private static final int FALLBACK_TITLE_LENGTH = 70;
  private static final int FALLBACK_KEYWORD_LIMIT = 7;

  private static final KnowledgeBase EMPTY = new KnowledgeBase(List.of());

  private final List<SnippetRecord> snippets;
  private final Map<String, SnippetRecord> snippetsById;
  private final SnippetGraph graph;
  private final Map<RetrievalStrategy, SnippetScorer> scorers;

  private KnowledgeBase(List<SnippetRecord> snippets) {
    Map<String, SnippetRecord> byId = new LinkedHashMap<>();
    snippets.forEach(snippet -> byId.put(snippet.id(), snippet));
    this.snippets = List.copyOf(snippets);
    this.snippetsById = Collections.unmodifiableMap(byId);
    this.graph = SnippetGraph.of(this.snippets);

    Map<RetrievalStrategy, SnippetScorer> byStrategy = new EnumMap<>(RetrievalStrategy.class);
    for (RetrievalStrategy strategy : RetrievalStrategy.values()) {
      byStrategy.put(strategy, strategy.createScorer(graph));
    }
    this.scorers = Collections.unmodifiableMap(byStrategy);
  }

  /**
   * 空知识库（RAG 关闭时使用），查询总是返回空结果
   */
  public static KnowledgeBase empty() {
    return EMPTY;
  }

  /**
   * 从原始数据条目构建知识库
   *
   * @throws EmptyDatasetException 没有任何可用记录
   */
  public static KnowledgeBase build(Collection<SourceRecord> sourceRecords) {
    Map<String, SnippetRecord> unique = new LinkedHashMap<>();
    int unusable = 0;

    if (sourceRecords != null) {
      for (SourceRecord source : sourceRecords) {
        if (source == null || !source.isUsable()) {
          unusable++;
          continue;
        }
        String id = source.id() != null && !source.id().isBlank()
          ? source.id().trim()
          : String.valueOf(unique.size());
        if (unique.containsKey(id)) {
          log.warn("Duplicate snippet id ignored: {}", id);
          continue;
        }
        unique.put(id, toSnippet(id, source));
      }
    }

    if (unique.isEmpty()) {
      throw new EmptyDatasetException(
        "No usable records to build the knowledge base from (unusable=" + unusable + ")");
    }

    log.info("Knowledge base built: snippets={}, unusable={}", unique.size(), unusable);
    return new KnowledgeBase(new ArrayList<>(unique.values()));
  }

  private static SnippetRecord toSnippet(String id, SourceRecord source) {
    String prompt = source.prompt() != null ? source.prompt().trim() : "";

    String title = source.title();
    if (title == null || title.isBlank()) {
      title = prompt.length() > FALLBACK_TITLE_LENGTH
        ? prompt.substring(0, FALLBACK_TITLE_LENGTH)
        : prompt;
    }

    List<String> rawKeywords = source.keywords();
    if (rawKeywords.isEmpty()) {
      rawKeywords = fallbackKeywords(prompt);
    }
    Set<String> keywords = TermExtractor.expandKeywords(rawKeywords);

    Set<String> resourceTypes = new TreeSet<>();
    source.resourceTypes().stream()
      .filter(type -> type != null && !type.isBlank())
      .forEach(type -> resourceTypes.add(type.trim().toLowerCase(Locale.ROOT)));
    if (resourceTypes.isEmpty()) {
      resourceTypes.addAll(TermExtractor.declaredResourceTypes(source.content()));
    }

    return new SnippetRecord(id, title.trim(), prompt, source.content(), new TreeSet<>(keywords),
      new TreeSet<>(resourceTypes));
  }

  private static List<String> fallbackKeywords(String prompt) {
    return Arrays.stream(prompt.split("\\s+"))
      .filter(word -> word.length() > 3 && word.chars().allMatch(Character::isLetterOrDigit))
      .map(word -> word.toLowerCase(Locale.ROOT))
      .distinct()
      .limit(FALLBACK_KEYWORD_LIMIT)
      .toList();
  }

  /**
   * 使用关键词策略查询
   */
  public RetrievalResult query(String text, int topK) {
    return query(text, topK, RetrievalStrategy.KEYWORD);
  }

  /**
   * 查询与请求最相关的片段
   *
   * @param text     请求文本，空文本返回空结果
   * @param topK     最多返回条数
   * @param strategy 打分策略
   */
  public RetrievalResult query(String text, int topK, RetrievalStrategy strategy) {
    if (snippets.isEmpty() || topK <= 0) {
      return RetrievalResult.empty();
    }
    RequestTerms terms = TermExtractor.requestTerms(text);
    if (terms.isEmpty()) {
      return RetrievalResult.empty();
    }

    SnippetScorer scorer = scorers.get(strategy != null ? strategy : RetrievalStrategy.KEYWORD);
    List<ScoredSnippet> ranked = snippets.stream()
      .map(snippet -> new ScoredSnippet(snippet, clamp(scorer.score(terms, snippet))))
      .filter(scored -> scored.score() > 0.0)
      .sorted(ScoredSnippet.RANKING)
      .limit(topK)
      .toList();
    return new RetrievalResult(ranked);
  }

  private static double clamp(double score) {
    if (Double.isNaN(score) || score < 0.0) {
      return 0.0;
    }
    return Math.min(1.0, score);
  }

  public int size() {
    return snippets.size();
  }

  public boolean isEmpty() {
    return snippets.isEmpty();
  }

  public List<SnippetRecord> snippets() {
    return snippets;
  }

  public SnippetRecord get(String id) {
    return snippetsById.get(id);
  }

  public SnippetGraph graph() {
    return graph;
  }

  public KnowledgeBaseStatistics statistics() {
    Set<String> keywords = new TreeSet<>();
    Set<String> resourceTypes = new TreeSet<>();
    long degreeSum = 0;
    for (SnippetRecord snippet : snippets) {
      keywords.addAll(snippet.keywords());
      resourceTypes.addAll(snippet.resourceTypes());
      degreeSum += graph.degree(SnippetGraph.snippetNode(snippet.id()));
    }
    double avgDegree = snippets.isEmpty() ? 0.0
      : Math.round(degreeSum * 100.0 / snippets.size()) / 100.0;
    return new KnowledgeBaseStatistics(snippets.size(), keywords.size(), resourceTypes.size(),
      graph.edgeCount(), avgDegree);
  }
}
