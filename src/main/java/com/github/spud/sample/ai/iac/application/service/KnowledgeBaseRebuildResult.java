package com.github.spud.sample.ai.iac.application.service;

import com.github.spud.sample.ai.iac.domain.rag.KnowledgeBaseStatistics;

/**
 * 知识库重建结果
 *
 * @param source         数据来源
 * @param loadedRecords  进入知识库的记录数
 * @param skippedLines   跳过的畸形行数
 * @param previousSize   重建前的片段数
 * @param statistics     新知识库统计
 */
public record KnowledgeBaseRebuildResult(
  String source,
  int loadedRecords,
  int skippedLines,
  int previousSize,
  KnowledgeBaseStatistics statistics
) {
}
