package com.github.spud.sample.ai.iac.application.service;

/**
 * 会话不存在（未创建或已被淘汰出历史记录）
 */
public class SessionNotFoundException extends RuntimeException {

  public SessionNotFoundException(String sessionId) {
    super("Session not found: " + sessionId);
  }
}
