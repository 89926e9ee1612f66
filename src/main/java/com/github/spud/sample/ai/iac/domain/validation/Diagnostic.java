package com.github.spud.sample.ai.iac.domain.validation;

/**
 * 一条校验发现
 *
 * @param severity 严重级别
 * @param message  描述
 * @param location 可选位置（文件:行号 或 资源引用），可能为 null
 */
public record Diagnostic(Severity severity, String message, String location) {

  public Diagnostic {
    if (severity == null) {
      throw new IllegalArgumentException("Diagnostic severity must not be null");
    }
    message = message != null ? message : "";
  }

  public static Diagnostic error(String message) {
    return new Diagnostic(Severity.ERROR, message, null);
  }

  public static Diagnostic error(String message, String location) {
    return new Diagnostic(Severity.ERROR, message, location);
  }

  public static Diagnostic warning(String message) {
    return new Diagnostic(Severity.WARNING, message, null);
  }

  public static Diagnostic warning(String message, String location) {
    return new Diagnostic(Severity.WARNING, message, location);
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  /**
   * 单行文本形式，如 {@code ERROR: Missing required argument (main.tf:3)}
   */
  public String render() {
    StringBuilder sb = new StringBuilder(severity.name()).append(": ").append(message);
    if (location != null && !location.isBlank()) {
      sb.append(" (").append(location).append(")");
    }
    return sb.toString();
  }
}
