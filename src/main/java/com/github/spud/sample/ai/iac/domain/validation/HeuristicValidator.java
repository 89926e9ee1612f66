package com.github.spud.sample.ai.iac.domain.validation;

import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * 不调用外部工具的校验：结构预检加常见资源的启发式检查
 */
@Slf4j
public class HeuristicValidator implements Validator {

  @Override
  public ValidationOutcome validate(String candidateCode) {
    List<Diagnostic> structural = StructuralChecks.check(candidateCode);
    if (!structural.isEmpty()) {
      return ValidationOutcome.structuralFailure(structural);
    }
    List<Diagnostic> findings = HeuristicChecks.check(candidateCode);
    log.debug("Heuristic validation found {} issue(s)", findings.size());
    return ValidationOutcome.of(findings, true);
  }
}
