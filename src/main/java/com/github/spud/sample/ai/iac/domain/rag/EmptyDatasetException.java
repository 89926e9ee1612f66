package com.github.spud.sample.ai.iac.domain.rag;

/**
 * 构建知识库时没有任何可用记录
 */
public class EmptyDatasetException extends RuntimeException {

  public EmptyDatasetException(String message) {
    super(message);
  }
}
