package com.github.spud.sample.ai.iac.domain.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.ai.iac.infrastructure.util.JsonUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.json.JsonParseException;

/**
 * 解析 {@code terraform validate} 输出
 * <p>
 * 优先解析 {@code -json} 输出；不是 JSON 时按行识别 {@code Error:} / {@code Warning:} 前缀
 */
@Slf4j
public final class TerraformOutputParser {

  private static final Pattern GUTTER = Pattern.compile("^[\\s│╷╵]+");
  private static final Pattern SOURCE_LOCATION = Pattern.compile("^on\\s+(\\S+)\\s+line\\s+(\\d+)");

  private TerraformOutputParser() {
  }

  public static List<Diagnostic> parse(CommandResult result) {
    String stdout = result.stdout().trim();
    if (JsonUtils.looksLikeJsonObject(stdout)) {
      try {
        return parseJson(JsonUtils.readTree(stdout), result);
      } catch (JsonParseException e) {
        log.debug("Terraform output is not valid JSON, falling back to text parsing: {}", e.getMessage());
      }
    }
    return parseText(result);
  }

  static List<Diagnostic> parseJson(JsonNode root, CommandResult result) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    JsonNode items = root.path("diagnostics");
    if (items.isArray()) {
      for (JsonNode item : items) {
        diagnostics.add(toDiagnostic(item));
      }
    }

    boolean valid = root.path("valid").asBoolean(result.isSuccess());
    boolean hasErrors = diagnostics.stream().anyMatch(Diagnostic::isError);
    if (!valid && !hasErrors) {
      diagnostics.add(Diagnostic.error(fallbackMessage(result)));
    }
    return diagnostics;
  }

  private static Diagnostic toDiagnostic(JsonNode item) {
    Severity severity = "warning".equalsIgnoreCase(item.path("severity").asText())
      ? Severity.WARNING
      : Severity.ERROR;
    String message = item.path("summary").asText("Unknown error");
    String detail = item.path("detail").asText("");
    if (!detail.isBlank()) {
      message = message + ": " + detail;
    }

    String location = null;
    JsonNode range = item.path("range");
    if (range.isObject()) {
      String filename = range.path("filename").asText("main.tf");
      JsonNode line = range.path("start").path("line");
      location = line.isMissingNode() ? filename : filename + ":" + line.asInt();
    }
    return new Diagnostic(severity, message, location);
  }

  static List<Diagnostic> parseText(CommandResult result) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    String combined = result.stdout() + "\n" + result.stderr();

    Severity pendingSeverity = null;
    String pendingMessage = null;
    String pendingLocation = null;
    for (String raw : combined.split("\\R")) {
      String line = GUTTER.matcher(raw).replaceFirst("").trim();
      Severity severity = null;
      String message = null;
      if (line.startsWith("Error:")) {
        severity = Severity.ERROR;
        message = line.substring("Error:".length()).trim();
      } else if (line.startsWith("Warning:")) {
        severity = Severity.WARNING;
        message = line.substring("Warning:".length()).trim();
      }

      if (severity != null) {
        if (pendingSeverity != null) {
          diagnostics.add(new Diagnostic(pendingSeverity, pendingMessage, pendingLocation));
        }
        pendingSeverity = severity;
        pendingMessage = message;
        pendingLocation = null;
        continue;
      }

      if (pendingSeverity != null && pendingLocation == null) {
        Matcher matcher = SOURCE_LOCATION.matcher(line);
        if (matcher.find()) {
          pendingLocation = stripTrailingComma(matcher.group(1)) + ":" + matcher.group(2);
        }
      }
    }
    if (pendingSeverity != null) {
      diagnostics.add(new Diagnostic(pendingSeverity, pendingMessage, pendingLocation));
    }

    // 无法识别的 stderr 内容整体作为一条错误
    if (diagnostics.isEmpty() && !result.stderr().isBlank()) {
      diagnostics.add(Diagnostic.error(result.stderr().trim()));
    }
    if (!result.isSuccess() && diagnostics.stream().noneMatch(Diagnostic::isError)) {
      diagnostics.add(Diagnostic.error(fallbackMessage(result)));
    }
    return diagnostics;
  }

  private static String fallbackMessage(CommandResult result) {
    String output = result.errorOutput();
    return output.isEmpty()
      ? "Terraform validation failed with exit code " + result.exitCode()
      : "Terraform validation failed: " + output;
  }

  private static String stripTrailingComma(String value) {
    return value.endsWith(",") ? value.substring(0, value.length() - 1) : value;
  }
}
