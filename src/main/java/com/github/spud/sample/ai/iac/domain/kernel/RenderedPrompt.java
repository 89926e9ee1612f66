package com.github.spud.sample.ai.iac.domain.kernel;

/**
 * 渲染后的 prompt 文本
 */
public record RenderedPrompt(String system, String user) {
}
