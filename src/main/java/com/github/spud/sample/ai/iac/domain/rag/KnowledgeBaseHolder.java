package com.github.spud.sample.ai.iac.domain.rag;

import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * 当前生效的知识库快照
 * <p>
 * 知识库本身只读；重建时整体替换引用，已开始的会话继续使用其启动时拿到的快照
 */
@Slf4j
public class KnowledgeBaseHolder {

  private final AtomicReference<KnowledgeBase> current;

  public KnowledgeBaseHolder(KnowledgeBase initial) {
    this.current = new AtomicReference<>(initial != null ? initial : KnowledgeBase.empty());
  }

  public KnowledgeBase get() {
    return current.get();
  }

  /**
   * 整体替换知识库
   *
   * @return 被替换掉的旧快照
   */
  public KnowledgeBase replace(KnowledgeBase rebuilt) {
    if (rebuilt == null) {
      throw new IllegalArgumentException("Knowledge base must not be null");
    }
    KnowledgeBase previous = current.getAndSet(rebuilt);
    log.info("Knowledge base replaced: {} -> {} snippets", previous.size(), rebuilt.size());
    return previous;
  }
}
