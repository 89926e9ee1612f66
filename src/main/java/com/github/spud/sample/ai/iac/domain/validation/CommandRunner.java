package com.github.spud.sample.ai.iac.domain.validation;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * 外部进程执行接口，测试中可替换为桩实现
 */
public interface CommandRunner {

  /**
   * 在指定目录执行命令并等待结束
   *
   * @throws IOException      进程无法启动（例如可执行文件不在 PATH 中）
   * @throws TimeoutException 超过 timeout 仍未结束，进程已被强制终止
   */
  CommandResult run(List<String> command, Path workDir, Duration timeout)
    throws IOException, TimeoutException, InterruptedException;
}
