package com.github.spud.sample.ai.iac.domain.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessCommandRunnerTest {

  private final ProcessCommandRunner runner = new ProcessCommandRunner();

  @TempDir
  Path workDir;

  @Test
  void shouldCaptureOutputAndExitCode() throws Exception {
    CommandResult result = runner.run(
      List.of("sh", "-c", "echo out; echo err >&2; echo $TF_IN_AUTOMATION; exit 3"),
      workDir, Duration.ofSeconds(10));

    assertThat(result.exitCode()).isEqualTo(3);
    assertThat(result.isSuccess()).isFalse();
    assertThat(result.stdout()).isEqualTo("out\n1\n");
    assertThat(result.stderr()).isEqualTo("err\n");
    assertThat(result.errorOutput()).isEqualTo("err");
  }

  @Test
  void shouldTimeOutLongRunningCommand() {
    assertThatThrownBy(() -> runner.run(List.of("sh", "-c", "sleep 5"), workDir, Duration.ofMillis(200)))
      .isInstanceOf(TimeoutException.class)
      .hasMessageContaining("timed out");
  }

  @Test
  void shouldFailForMissingBinary() {
    assertThatThrownBy(() -> runner.run(List.of("definitely-not-terraform-xyz", "version"), workDir,
      Duration.ofSeconds(5)))
      .isInstanceOf(IOException.class);
  }
}
