package com.github.spud.sample.ai.iac.domain.validation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * 基于 {@link ProcessBuilder} 的命令执行
 * <p>
 * 输出重定向到临时文件，避免管道缓冲区写满导致子进程阻塞
 */
@Slf4j
public class ProcessCommandRunner implements CommandRunner {

  @Override
  public CommandResult run(List<String> command, Path workDir, Duration timeout)
    throws IOException, TimeoutException, InterruptedException {
    Path stdoutFile = Files.createTempFile("cmd_", ".out");
    Path stderrFile = Files.createTempFile("cmd_", ".err");
    try {
      ProcessBuilder pb = new ProcessBuilder(command)
        .directory(workDir.toFile())
        .redirectOutput(stdoutFile.toFile())
        .redirectError(stderrFile.toFile());
      pb.environment().put("TF_IN_AUTOMATION", "1");
      pb.environment().put("TF_INPUT", "0");

      log.debug("Running {} in {}", command, workDir);
      Process process = pb.start();
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new TimeoutException("Command " + command.get(0) + " timed out after " + timeout.toSeconds() + "s");
      }

      return new CommandResult(
        process.exitValue(),
        Files.readString(stdoutFile, StandardCharsets.UTF_8),
        Files.readString(stderrFile, StandardCharsets.UTF_8)
      );
    } finally {
      deleteQuietly(stdoutFile);
      deleteQuietly(stderrFile);
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Failed to delete temporary file {}: {}", file, e.getMessage());
    }
  }
}
