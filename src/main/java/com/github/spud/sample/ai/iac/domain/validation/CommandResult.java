package com.github.spud.sample.ai.iac.domain.validation;

/**
 * 外部命令执行结果
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

  public CommandResult {
    stdout = stdout != null ? stdout : "";
    stderr = stderr != null ? stderr : "";
  }

  public boolean isSuccess() {
    return exitCode == 0;
  }

  /**
   * stderr 优先，为空时退回 stdout
   */
  public String errorOutput() {
    return !stderr.isBlank() ? stderr.trim() : stdout.trim();
  }
}
