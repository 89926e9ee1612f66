package com.github.spud.sample.ai.iac.domain.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 去掉模型输出中的 markdown 代码围栏
 */
public final class ModelOutputCleaner {

  private static final Pattern FENCED_BLOCK =
    Pattern.compile("```[ \\t]*(?:hcl|terraform|tf)?[ \\t]*\\R(.*?)```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

  private static final Pattern LEADING_FENCE =
    Pattern.compile("^```[ \\t]*(?:hcl|terraform|tf)?[ \\t]*\\R?", Pattern.CASE_INSENSITIVE);

  private ModelOutputCleaner() {
  }

  /**
   * 有围栏时取第一个代码块内容，否则去掉残留的首尾围栏
   */
  public static String clean(String text) {
    if (text == null) {
      return "";
    }
    String trimmed = text.trim();
    Matcher matcher = FENCED_BLOCK.matcher(trimmed);
    if (matcher.find()) {
      return matcher.group(1).trim();
    }
    String cleaned = LEADING_FENCE.matcher(trimmed).replaceFirst("");
    if (cleaned.endsWith("```")) {
      cleaned = cleaned.substring(0, cleaned.length() - 3);
    }
    return cleaned.trim();
  }
}
