package com.github.spud.sample.ai.iac.domain.model;

/**
 * 代码生成模型边界
 */
public interface CodeModel {

  /**
   * 根据 prompt 生成 Terraform 代码
   *
   * @param systemPrompt 系统指令
   * @param userPrompt   用户消息（请求、参考片段、上次的诊断）
   * @return 清理并去除首尾空白后的代码文本
   * @throws ModelFailureException 调用失败或超时
   */
  String generate(String systemPrompt, String userPrompt);
}
