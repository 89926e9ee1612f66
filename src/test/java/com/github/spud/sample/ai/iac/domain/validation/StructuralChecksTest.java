package com.github.spud.sample.ai.iac.domain.validation;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * 结构预检测试
 */
class StructuralChecksTest {

  @Test
  void shouldPassWellFormedConfiguration() {
    String code = """
      provider "aws" {
        region = "us-east-1"
      }

      resource "aws_s3_bucket" "data" {
        bucket = "acme-data"
      }
      """;

    assertThat(StructuralChecks.check(code)).isEmpty();
    assertThat(StructuralChecks.passes(code)).isTrue();
  }

  @Test
  void shouldRejectEmptyCode() {
    assertThat(StructuralChecks.check("  \n"))
      .extracting(Diagnostic::message)
      .containsExactly(StructuralChecks.EMPTY_MESSAGE);
  }

  @Test
  void shouldRejectUnbalancedBraces() {
    List<Diagnostic> diagnostics = StructuralChecks.check("""
      resource "aws_vpc" "main" {
        cidr_block = "10.0.0.0/16"
      """);

    assertThat(diagnostics).hasSize(1);
    assertThat(diagnostics.get(0).isError()).isTrue();
    assertThat(diagnostics.get(0).message()).startsWith(StructuralChecks.UNBALANCED_MESSAGE);
  }

  @Test
  void shouldRejectStrayClosingBrace() {
    assertThat(StructuralChecks.braceBalance("}{")).isEqualTo(-1);
  }

  @Test
  void shouldIgnoreBracesInStringsAndComments() {
    String code = """
      # closing } in a comment
      // another { comment
      /* block { comment */
      resource "aws_iam_policy" "p" {
        policy = "{\\"Version\\": \\"2012-10-17\\"}"
        name   = "${var.prefix}-policy"
      }
      """;

    assertThat(StructuralChecks.braceBalance(code)).isZero();
    assertThat(StructuralChecks.check(code)).isEmpty();
  }

  @Test
  void shouldRequireResourceBlock() {
    assertThat(StructuralChecks.check("variable \"region\" {\n  default = \"us-east-1\"\n}"))
      .extracting(Diagnostic::message)
      .containsExactly(StructuralChecks.NO_RESOURCE_MESSAGE);
  }

  @Test
  void shouldReportEveryFailedCheck() {
    assertThat(StructuralChecks.check("locals {")).hasSize(2);
  }
}
