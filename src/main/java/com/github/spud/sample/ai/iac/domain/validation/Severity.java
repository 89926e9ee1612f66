package com.github.spud.sample.ai.iac.domain.validation;

/**
 * 诊断严重级别
 */
public enum Severity {
  ERROR,
  WARNING
}
