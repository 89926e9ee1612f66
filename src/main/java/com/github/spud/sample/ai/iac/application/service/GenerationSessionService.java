package com.github.spud.sample.ai.iac.application.service;

import com.github.spud.sample.ai.iac.application.config.GenerationProperties;
import com.github.spud.sample.ai.iac.application.config.RagProperties;
import com.github.spud.sample.ai.iac.domain.kernel.GenerationKernel;
import com.github.spud.sample.ai.iac.domain.kernel.GenerationOptions;
import com.github.spud.sample.ai.iac.domain.kernel.GenerationResult;
import com.github.spud.sample.ai.iac.domain.kernel.GenerationSession;
import com.github.spud.sample.ai.iac.domain.kernel.GenerationSettings;
import com.github.spud.sample.ai.iac.domain.kernel.InvalidGenerationOptionsException;
import com.github.spud.sample.ai.iac.domain.rag.EmptyDatasetException;
import com.github.spud.sample.ai.iac.domain.rag.KnowledgeBase;
import com.github.spud.sample.ai.iac.domain.rag.KnowledgeBaseHolder;
import com.github.spud.sample.ai.iac.domain.rag.KnowledgeBaseLoader;
import com.github.spud.sample.ai.iac.domain.rag.KnowledgeBaseStatistics;
import com.github.spud.sample.ai.iac.domain.rag.KnowledgeBaseWriter;
import com.github.spud.sample.ai.iac.domain.rag.RetrievalResult;
import com.github.spud.sample.ai.iac.domain.rag.Retriever;
import com.github.spud.sample.ai.iac.domain.rag.scoring.RetrievalStrategy;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 生成会话服务：会话登记、批量执行、取消，以及知识库的检索预览与重建
 */
@Slf4j
@Service
public class GenerationSessionService {

  private final GenerationKernel generationKernel;
  private final GenerationProperties generationProperties;
  private final RagProperties ragProperties;
  private final Retriever retriever;
  private final KnowledgeBaseHolder knowledgeBaseHolder;
  private final KnowledgeBaseLoader knowledgeBaseLoader;
  private final KnowledgeBaseWriter knowledgeBaseWriter;
  private final ResourceLoader resourceLoader;

  /**
   * 运行中的会话
   */
  private final Map<String, GenerationSession> running = new ConcurrentHashMap<>();

  /**
   * 已结束的会话，按结束顺序保留最近的若干个
   */
  private final Map<String, GenerationSession> finished;

  public GenerationSessionService(GenerationKernel generationKernel,
    GenerationProperties generationProperties, RagProperties ragProperties, Retriever retriever,
    KnowledgeBaseHolder knowledgeBaseHolder, KnowledgeBaseLoader knowledgeBaseLoader,
    KnowledgeBaseWriter knowledgeBaseWriter, ResourceLoader resourceLoader) {
    this.generationKernel = generationKernel;
    this.generationProperties = generationProperties;
    this.ragProperties = ragProperties;
    this.retriever = retriever;
    this.knowledgeBaseHolder = knowledgeBaseHolder;
    this.knowledgeBaseLoader = knowledgeBaseLoader;
    this.knowledgeBaseWriter = knowledgeBaseWriter;
    this.resourceLoader = resourceLoader;

    int historySize = Math.max(1, generationProperties.getSessionHistorySize());
    this.finished = new LinkedHashMap<>(16, 0.75f, false) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, GenerationSession> eldest) {
        return size() > historySize;
      }
    };
  }

  /**
   * 创建会话，只校验参数；会话在 {@link #run(GenerationSession)} 开始时才登记
   *
   * @throws InvalidGenerationOptionsException 请求文本为空或配置不合法
   */
  public GenerationSession open(String request, GenerationOptions options) {
    if (!StringUtils.hasText(request)) {
      throw new InvalidGenerationOptionsException("Request text must not be blank");
    }
    GenerationSettings settings = GenerationSettings.resolve(options, generationProperties, ragProperties);
    return new GenerationSession(request, settings);
  }

  /**
   * 登记会话并在当前线程执行直到终态
   */
  public GenerationResult run(GenerationSession session) {
    running.put(session.getSessionId(), session);
    try {
      return generationKernel.execute(session);
    } finally {
      running.remove(session.getSessionId());
      synchronized (finished) {
        finished.put(session.getSessionId(), session);
      }
    }
  }

  public GenerationResult generate(String request, GenerationOptions options) {
    return run(open(request, options));
  }

  /**
   * 批量生成：每个请求一个独立会话，并发数受 batch-concurrency 限制，结果顺序与请求顺序一致
   * <p>
   * 先校验全部请求，任一配置不合法时整个批次在执行前失败；未被执行到的会话不会登记
   */
  public Flux<GenerationResult> generateBatch(List<String> requests, GenerationOptions options) {
    if (requests == null || requests.isEmpty()) {
      return Flux.empty();
    }
    List<GenerationSession> sessions = new ArrayList<>(requests.size());
    for (String request : requests) {
      sessions.add(open(request, options));
    }
    int concurrency = Math.max(1, generationProperties.getBatchConcurrency());
    log.info("Running batch of {} session(s) with concurrency {}", sessions.size(), concurrency);

    return Flux.fromIterable(sessions)
      .flatMapSequential(session -> Mono.fromCallable(() -> run(session))
        .subscribeOn(Schedulers.boundedElastic()), concurrency);
  }

  public Optional<GenerationSession> find(String sessionId) {
    GenerationSession session = running.get(sessionId);
    if (session != null) {
      return Optional.of(session);
    }
    synchronized (finished) {
      return Optional.ofNullable(finished.get(sessionId));
    }
  }

  public GenerationSession get(String sessionId) {
    return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
  }

  /**
   * 请求取消
   *
   * @return 会话已结束时返回 false
   */
  public boolean cancel(String sessionId) {
    GenerationSession session = get(sessionId);
    boolean accepted = session.cancel();
    log.info("Cancel requested for session {}: accepted={}", sessionId, accepted);
    return accepted;
  }

  /**
   * 最近的会话（运行中与已结束），按创建时间倒序
   */
  public List<SessionSummary> recentSessions(int limit) {
    List<GenerationSession> all = new ArrayList<>(running.values());
    synchronized (finished) {
      all.addAll(finished.values());
    }
    return all.stream()
      .sorted(Comparator.comparing(GenerationSession::getCreatedAt).reversed())
      .limit(Math.max(0, limit))
      .map(SessionSummary::fromSession)
      .toList();
  }

  /**
   * 检索预览，参数为空时使用默认配置
   */
  public RetrievalResult retrieve(String request, Integer topK, RetrievalStrategy strategy) {
    int k = topK != null ? topK : generationProperties.getTopK();
    if (k < 1 || k > GenerationSettings.MAX_TOP_K) {
      throw new InvalidGenerationOptionsException(
        "topK must be between 1 and " + GenerationSettings.MAX_TOP_K + ": " + k);
    }
    RetrievalStrategy s = strategy != null ? strategy : generationProperties.getRetrievalStrategy();
    return retriever.retrieve(request, k, s);
  }

  public KnowledgeBaseStatistics knowledgeBaseStatistics() {
    return knowledgeBaseHolder.get().statistics();
  }

  /**
   * 从 JSONL 文件全量重建知识库并原子替换；运行中的会话继续使用已检索到的结果
   *
   * @param location Spring Resource 路径，为空时使用 app.rag.kb-file
   * @throws IllegalArgumentException 文件不存在
   * @throws EmptyDatasetException    没有有效记录
   */
  public KnowledgeBaseRebuildResult rebuildKnowledgeBase(String location) {
    String source = StringUtils.hasText(location) ? location : ragProperties.getKbFile();
    Resource resource = resourceLoader.getResource(source);
    if (!resource.exists()) {
      throw new IllegalArgumentException("Knowledge base source not found: " + source);
    }

    KnowledgeBaseLoader.LoadReport report;
    try {
      report = knowledgeBaseLoader.load(resource);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read knowledge base source " + source, e);
    }

    KnowledgeBase previous = knowledgeBaseHolder.replace(report.knowledgeBase());
    return new KnowledgeBaseRebuildResult(source, report.loadedRecords(), report.skippedLines(),
      previous.size(), report.knowledgeBase().statistics());
  }

  /**
   * 以 JSONL 格式导出当前知识库
   */
  public String exportKnowledgeBase() {
    StringWriter writer = new StringWriter();
    try {
      knowledgeBaseWriter.write(knowledgeBaseHolder.get(), writer);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to export knowledge base", e);
    }
    return writer.toString();
  }
}
