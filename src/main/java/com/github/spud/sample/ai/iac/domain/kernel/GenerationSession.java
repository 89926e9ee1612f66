package com.github.spud.sample.ai.iac.domain.kernel;

import com.github.spud.sample.ai.iac.domain.rag.RetrievalResult;
import com.github.spud.sample.ai.iac.domain.state.GenerationState;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * 一个生成请求的会话
 * <p>
 * 只由自己的控制循环修改；尝试历史只追加不改写，其他线程只能读取快照或请求取消
 */
@Getter
public class GenerationSession {

  private final String sessionId;

  private final String request;

  private final GenerationSettings settings;

  private final Instant createdAt;

  private final List<GenerationAttempt> attempts = new CopyOnWriteArrayList<>();

  @Getter(AccessLevel.NONE)
  private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

  private volatile GenerationState state = GenerationState.IDLE;

  /**
   * 会话开始时检索一次，后续重试复用
   */
  private volatile RetrievalResult retrieval;

  private volatile GenerationResult result;

  public GenerationSession(String request, GenerationSettings settings) {
    this(UUID.randomUUID().toString(), request, settings);
  }

  public GenerationSession(String sessionId, String request, GenerationSettings settings) {
    if (request == null || request.isBlank()) {
      throw new IllegalArgumentException("Request must not be blank");
    }
    if (settings == null) {
      throw new IllegalArgumentException("Settings must not be null");
    }
    this.sessionId = sessionId;
    this.request = request;
    this.settings = settings;
    this.createdAt = Instant.now();
  }

  /**
   * 只读视图
   */
  public List<GenerationAttempt> getAttempts() {
    return Collections.unmodifiableList(attempts);
  }

  public int attemptCount() {
    return attempts.size();
  }

  public Optional<GenerationAttempt> lastAttempt() {
    return attempts.isEmpty() ? Optional.empty() : Optional.of(attempts.get(attempts.size() - 1));
  }

  /**
   * 请求取消；正在进行的模型或校验调用会完成，但不会再开始新的尝试
   *
   * @return 会话已结束时返回 false
   */
  public boolean cancel() {
    if (isFinished()) {
      return false;
    }
    cancelRequested.set(true);
    return true;
  }

  public boolean isCancelled() {
    return cancelRequested.get();
  }

  public boolean isFinished() {
    return result != null;
  }

  void append(GenerationAttempt attempt) {
    int expected = attempts.size() + 1;
    if (attempt.attemptNumber() != expected) {
      throw new IllegalStateException(
        "Attempt " + attempt.attemptNumber() + " appended out of order, expected " + expected);
    }
    if (attempts.size() >= settings.maxAttempts()) {
      throw new IllegalStateException("Attempt budget of " + settings.maxAttempts() + " exceeded");
    }
    attempts.add(attempt);
  }

  void setState(GenerationState state) {
    this.state = state;
  }

  void setRetrieval(RetrievalResult retrieval) {
    this.retrieval = retrieval;
  }

  void complete(GenerationResult result) {
    this.result = result;
  }
}
