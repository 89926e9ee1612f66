package com.github.spud.sample.ai.iac.interfaces.rest;

import com.github.spud.sample.ai.iac.application.service.GenerationSessionService;
import com.github.spud.sample.ai.iac.application.service.SessionSummary;
import com.github.spud.sample.ai.iac.domain.kernel.GenerationOptions;
import com.github.spud.sample.ai.iac.domain.kernel.GenerationResult;
import com.github.spud.sample.ai.iac.domain.kernel.GenerationSession;
import com.github.spud.sample.ai.iac.domain.kernel.GenerationSettings;
import com.github.spud.sample.ai.iac.domain.rag.scoring.RetrievalStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Terraform 生成 API：单次生成、批量生成、会话查询与取消
 */
@Slf4j
@RestController
@RequestMapping("/iac")
@RequiredArgsConstructor
public class GenerationController {

  private final GenerationSessionService generationSessionService;

  /**
   * 执行一次生成会话（同步等待结束）
   */
  @PostMapping("/generate")
  public Mono<ResponseEntity<GenerationResult>> generate(@Valid @RequestBody GenerateRequest request) {
    return Mono.fromCallable(() -> {
      log.info("Received generation request: {}", StringUtils.truncate(request.getRequest(), 100));
      GenerationSession session = generationSessionService.open(request.getRequest(), request.toOptions());
      return ResponseEntity.ok(generationSessionService.run(session));
    }).subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * 批量生成，结果顺序与请求顺序一致
   */
  @PostMapping("/generate/batch")
  public Mono<ResponseEntity<List<GenerationResult>>> generateBatch(
    @Valid @RequestBody BatchGenerateRequest request) {
    log.info("Received batch generation request: {} prompt(s)", request.getRequests().size());
    return Mono.defer(() -> generationSessionService
        .generateBatch(request.getRequests(), request.toOptions())
        .collectList())
      .subscribeOn(Schedulers.boundedElastic())
      .map(ResponseEntity::ok);
  }

  /**
   * 已结束的会话返回完整结果；运行中的会话返回 202 与摘要
   */
  @GetMapping("/sessions/{sessionId}")
  public ResponseEntity<?> getSession(@PathVariable String sessionId) {
    GenerationSession session = generationSessionService.get(sessionId);
    if (session.isFinished()) {
      return ResponseEntity.ok(session.getResult());
    }
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(SessionSummary.fromSession(session));
  }

  @GetMapping("/sessions")
  public ResponseEntity<List<SessionSummary>> listSessions(
    @RequestParam(defaultValue = "20") int limit) {
    return ResponseEntity.ok(generationSessionService.recentSessions(limit));
  }

  @PostMapping("/sessions/{sessionId}/cancel")
  public ResponseEntity<CancelResponse> cancel(@PathVariable String sessionId) {
    boolean accepted = generationSessionService.cancel(sessionId);
    return ResponseEntity.ok(new CancelResponse(sessionId, accepted,
      accepted ? "Cancellation requested" : "Session already finished"));
  }

  // ===== Request/Response DTOs =====

  @Data
  public static class GenerateRequest {

    @NotBlank
    private String request;
    @Min(0)
    @Max(GenerationSettings.MAX_RETRIES_LIMIT)
    private Integer maxRetries;
    @Min(1)
    @Max(GenerationSettings.MAX_TOP_K)
    private Integer topK;
    private RetrievalStrategy retrievalStrategy;
    private Boolean bestEffortAcceptance;
    private Boolean ragEnabled;

    GenerationOptions toOptions() {
      return GenerationOptions.builder()
        .maxRetries(maxRetries)
        .topK(topK)
        .retrievalStrategy(retrievalStrategy)
        .bestEffortAcceptance(bestEffortAcceptance)
        .ragEnabled(ragEnabled)
        .build();
    }
  }

  @Data
  public static class BatchGenerateRequest {

    @NotEmpty
    private List<@NotBlank String> requests;
    @Min(0)
    @Max(GenerationSettings.MAX_RETRIES_LIMIT)
    private Integer maxRetries;
    @Min(1)
    @Max(GenerationSettings.MAX_TOP_K)
    private Integer topK;
    private RetrievalStrategy retrievalStrategy;
    private Boolean bestEffortAcceptance;
    private Boolean ragEnabled;

    GenerationOptions toOptions() {
      return GenerationOptions.builder()
        .maxRetries(maxRetries)
        .topK(topK)
        .retrievalStrategy(retrievalStrategy)
        .bestEffortAcceptance(bestEffortAcceptance)
        .ragEnabled(ragEnabled)
        .build();
    }
  }

  @Data
  public static class CancelResponse {

    private String sessionId;
    private boolean accepted;
    private String message;

    public CancelResponse() {
    }

    public CancelResponse(String sessionId, boolean accepted, String message) {
      this.sessionId = sessionId;
      this.accepted = accepted;
      this.message = message;
    }
  }
}
