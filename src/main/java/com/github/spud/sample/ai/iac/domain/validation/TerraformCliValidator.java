package com.github.spud.sample.ai.iac.domain.validation;

import com.github.spud.sample.ai.iac.application.config.ValidationProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 通过 Terraform CLI 校验候选代码
 * <p>
 * 每次校验使用独立的临时目录（写入 main.tf，依次执行 init 与 validate），无论结果如何都会删除该目录，
 * 因此可以被多个会话并发调用
 */
@Slf4j
@RequiredArgsConstructor
public class TerraformCliValidator implements Validator {

  static final String WORK_DIR_PREFIX = "tf_validate_";
  static final String MAIN_FILE = "main.tf";

  private final CommandRunner commandRunner;
  private final ValidationProperties properties;

  @Override
  public ValidationOutcome validate(String candidateCode) {
    List<Diagnostic> structural = StructuralChecks.check(candidateCode);
    if (!structural.isEmpty()) {
      log.debug("Structural checks failed, skipping terraform: {}", structural);
      return ValidationOutcome.structuralFailure(structural);
    }

    Path workDir = null;
    try {
      workDir = createWorkDir();
      Files.writeString(workDir.resolve(MAIN_FILE), candidateCode, StandardCharsets.UTF_8);

      if (properties.isInitEnabled()) {
        CommandResult init = commandRunner.run(initCommand(), workDir, properties.getTimeout());
        if (!init.isSuccess()) {
          log.debug("terraform init failed with exit code {}", init.exitCode());
          return ValidationOutcome.of(
            List.of(Diagnostic.error("Terraform init failed: " + init.errorOutput())), true);
        }
      }

      CommandResult validate = commandRunner.run(validateCommand(), workDir, properties.getTimeout());
      List<Diagnostic> diagnostics = TerraformOutputParser.parse(validate);
      ValidationOutcome outcome = ValidationOutcome.of(diagnostics, true);
      log.debug("terraform validate finished: status={}, diagnostics={}", outcome.status(), diagnostics.size());
      return outcome;
    } catch (TimeoutException e) {
      log.warn("Terraform validation timed out: {}", e.getMessage());
      return ValidationOutcome.toolUnavailable(e.getMessage());
    } catch (IOException e) {
      log.warn("Terraform validation could not run: {}", e.getMessage());
      return ValidationOutcome.toolUnavailable(e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Terraform validation interrupted");
      return ValidationOutcome.toolUnavailable("interrupted");
    } finally {
      deleteWorkDir(workDir);
    }
  }

  List<String> initCommand() {
    return List.of(properties.getTerraformBinary(), "init", "-backend=false", "-input=false", "-no-color");
  }

  List<String> validateCommand() {
    return List.of(properties.getTerraformBinary(), "validate", "-json", "-no-color");
  }

  private Path createWorkDir() throws IOException {
    String parent = properties.getWorkDirParent();
    if (parent == null || parent.isBlank()) {
      return Files.createTempDirectory(WORK_DIR_PREFIX);
    }
    Path parentDir = Files.createDirectories(Paths.get(parent));
    return Files.createTempDirectory(parentDir, WORK_DIR_PREFIX);
  }

  private static void deleteWorkDir(Path workDir) {
    if (workDir == null || !Files.exists(workDir)) {
      return;
    }
    List<Path> paths = new ArrayList<>();
    try (Stream<Path> walk = Files.walk(workDir)) {
      walk.sorted(Comparator.reverseOrder()).forEach(paths::add);
    } catch (IOException e) {
      log.warn("Failed to list temporary directory {}: {}", workDir, e.getMessage());
      return;
    }
    for (Path path : paths) {
      try {
        Files.deleteIfExists(path);
      } catch (IOException e) {
        log.warn("Failed to clean up {}: {}", path, e.getMessage());
      }
    }
  }
}
