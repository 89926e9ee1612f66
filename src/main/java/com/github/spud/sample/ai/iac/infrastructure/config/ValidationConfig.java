package com.github.spud.sample.ai.iac.infrastructure.config;

import com.github.spud.sample.ai.iac.application.config.ValidationProperties;
import com.github.spud.sample.ai.iac.domain.validation.CommandRunner;
import com.github.spud.sample.ai.iac.domain.validation.HeuristicValidator;
import com.github.spud.sample.ai.iac.domain.validation.ProcessCommandRunner;
import com.github.spud.sample.ai.iac.domain.validation.TerraformCliValidator;
import com.github.spud.sample.ai.iac.domain.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 校验器装配，按 app.iac.validation.mode 选择实现
 */
@Slf4j
@Configuration
public class ValidationConfig {

  @Bean
  public CommandRunner commandRunner() {
    return new ProcessCommandRunner();
  }

  @Bean
  public Validator validator(ValidationProperties properties, CommandRunner commandRunner) {
    if (properties.getMode() == ValidationProperties.Mode.HEURISTIC) {
      log.info("Using heuristic validation (terraform CLI disabled)");
      return new HeuristicValidator();
    }
    log.info("Using terraform CLI validation: binary={}, timeout={}s, init={}",
      properties.getTerraformBinary(), properties.getTimeout().toSeconds(), properties.isInitEnabled());
    return new TerraformCliValidator(commandRunner, properties);
  }
}
