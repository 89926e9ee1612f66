package com.github.spud.sample.ai.iac.interfaces.rest;

import com.github.spud.sample.ai.iac.application.service.GenerationSessionService;
import com.github.spud.sample.ai.iac.application.service.KnowledgeBaseRebuildResult;
import com.github.spud.sample.ai.iac.domain.kernel.GenerationSettings;
import com.github.spud.sample.ai.iac.domain.rag.KnowledgeBaseStatistics;
import com.github.spud.sample.ai.iac.domain.rag.RetrievalResult;
import com.github.spud.sample.ai.iac.domain.rag.scoring.RetrievalStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.nio.charset.StandardCharsets;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 知识库 API：检索预览、统计、重建与导出
 */
@Slf4j
@RestController
@RequestMapping("/iac")
@RequiredArgsConstructor
public class KnowledgeBaseController {

  private final GenerationSessionService generationSessionService;

  @PostMapping("/retrieve")
  public ResponseEntity<RetrievalResult> retrieve(@Valid @RequestBody RetrieveRequest request) {
    return ResponseEntity.ok(generationSessionService.retrieve(request.getRequest(), request.getTopK(),
      request.getStrategy()));
  }

  @GetMapping("/kb/stats")
  public ResponseEntity<KnowledgeBaseStatistics> stats() {
    return ResponseEntity.ok(generationSessionService.knowledgeBaseStatistics());
  }

  /**
   * 从配置的 JSONL 文件重建知识库
   */
  @PostMapping("/kb/rebuild")
  public Mono<ResponseEntity<KnowledgeBaseRebuildResult>> rebuild() {
    return Mono.fromCallable(() -> {
      log.info("Rebuilding knowledge base");
      return ResponseEntity.ok(generationSessionService.rebuildKnowledgeBase(null));
    }).subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * 以 JSONL 导出当前知识库
   */
  @GetMapping(value = "/kb/export", produces = MediaType.APPLICATION_NDJSON_VALUE)
  public ResponseEntity<byte[]> export() {
    // 原样输出 JSONL 字节
    return ResponseEntity.ok(generationSessionService.exportKnowledgeBase().getBytes(StandardCharsets.UTF_8));
  }

  @Data
  public static class RetrieveRequest {

    /**
     * 空文本返回空结果
     */
    private String request;
    @Min(1)
    @Max(GenerationSettings.MAX_TOP_K)
    private Integer topK;
    private RetrievalStrategy strategy;
  }
}
