package com.github.spud.sample.ai.iac.domain.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 不依赖外部工具的结构预检（纯函数）
 * <ul>
 *   <li>非空</li>
 *   <li>花括号配对（忽略字符串与注释中的括号）</li>
 *   <li>至少一个 {@code resource "<type>" "<name>"} 声明</li>
 * </ul>
 */
public final class StructuralChecks {

  static final String EMPTY_MESSAGE = "Structural check failed: generated code is empty";
  static final String UNBALANCED_MESSAGE = "Structural check failed: unbalanced braces";
  static final String NO_RESOURCE_MESSAGE =
    "Structural check failed: no resource \"<type>\" \"<name>\" block declared";

  private static final Pattern RESOURCE_BLOCK =
    Pattern.compile("(?m)^\\s*resource\\s+\"[^\"]+\"\\s+\"[^\"]+\"\\s*\\{");

  private StructuralChecks() {
  }

  /**
   * 执行全部结构检查
   *
   * @return 失败项对应的 ERROR 诊断；全部通过时为空列表
   */
  public static List<Diagnostic> check(String code) {
    if (code == null || code.isBlank()) {
      return List.of(Diagnostic.error(EMPTY_MESSAGE));
    }
    List<Diagnostic> failures = new ArrayList<>();
    int depth = braceBalance(code);
    if (depth != 0) {
      failures.add(Diagnostic.error(UNBALANCED_MESSAGE
        + (depth > 0 ? " (" + depth + " unclosed)" : " (unexpected closing brace)")));
    }
    if (!RESOURCE_BLOCK.matcher(code).find()) {
      failures.add(Diagnostic.error(NO_RESOURCE_MESSAGE));
    }
    return failures;
  }

  public static boolean passes(String code) {
    return check(code).isEmpty();
  }

  /**
   * 计算未闭合的花括号数；出现多余的右括号时立即返回 -1
   */
  static int braceBalance(String code) {
    int depth = 0;
    int length = code.length();
    int i = 0;
    while (i < length) {
      char c = code.charAt(i);
      if (c == '"') {
        i = skipString(code, i + 1);
        continue;
      }
      if (c == '#' || (c == '/' && i + 1 < length && code.charAt(i + 1) == '/')) {
        i = skipLine(code, i);
        continue;
      }
      if (c == '/' && i + 1 < length && code.charAt(i + 1) == '*') {
        int end = code.indexOf("*/", i + 2);
        i = end < 0 ? length : end + 2;
        continue;
      }
      if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
        if (depth < 0) {
          return -1;
        }
      }
      i++;
    }
    return depth;
  }

  private static int skipString(String code, int from) {
    int i = from;
    while (i < code.length()) {
      char c = code.charAt(i);
      if (c == '\\') {
        i += 2;
        continue;
      }
      if (c == '"' || c == '\n') {
        return i + 1;
      }
      i++;
    }
    return i;
  }

  private static int skipLine(String code, int from) {
    int end = code.indexOf('\n', from);
    return end < 0 ? code.length() : end + 1;
  }
}
