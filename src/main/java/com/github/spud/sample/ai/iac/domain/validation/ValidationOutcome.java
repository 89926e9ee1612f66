package com.github.spud.sample.ai.iac.domain.validation;

import java.util.List;

/**
 * 一次校验的结果
 *
 * @param status                 结论
 * @param diagnostics            有序诊断列表
 * @param structuralChecksPassed 结构预检是否通过（TOOL_UNAVAILABLE 时用于判断能否尽力接受）
 */
public record ValidationOutcome(
  ValidationStatus status,
  List<Diagnostic> diagnostics,
  boolean structuralChecksPassed
) {

  public ValidationOutcome {
    if (status == null) {
      throw new IllegalArgumentException("Validation status must not be null");
    }
    diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    if (status == ValidationStatus.VALID && diagnostics.stream().anyMatch(Diagnostic::isError)) {
      throw new IllegalArgumentException("A valid outcome cannot carry error diagnostics");
    }
  }

  /**
   * 根据诊断列表得出 VALID / INVALID
   */
  public static ValidationOutcome of(List<Diagnostic> diagnostics, boolean structuralChecksPassed) {
    boolean hasErrors = diagnostics.stream().anyMatch(Diagnostic::isError);
    return new ValidationOutcome(hasErrors ? ValidationStatus.INVALID : ValidationStatus.VALID,
      diagnostics, structuralChecksPassed);
  }

  public static ValidationOutcome valid() {
    return new ValidationOutcome(ValidationStatus.VALID, List.of(), true);
  }

  public static ValidationOutcome structuralFailure(List<Diagnostic> diagnostics) {
    return new ValidationOutcome(ValidationStatus.INVALID, diagnostics, false);
  }

  /**
   * 外部工具无法运行：记录一条 WARNING，避免误报“已校验通过”
   */
  public static ValidationOutcome toolUnavailable(String reason) {
    return new ValidationOutcome(ValidationStatus.TOOL_UNAVAILABLE,
      List.of(Diagnostic.warning("Terraform validation could not run: " + reason)), true);
  }

  public boolean isValid() {
    return status == ValidationStatus.VALID;
  }

  public boolean isToolUnavailable() {
    return status == ValidationStatus.TOOL_UNAVAILABLE;
  }

  public List<Diagnostic> errors() {
    return diagnostics.stream().filter(Diagnostic::isError).toList();
  }
}
