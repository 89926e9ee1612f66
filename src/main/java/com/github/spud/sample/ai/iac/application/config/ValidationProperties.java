package com.github.spud.sample.ai.iac.application.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 校验配置属性
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.iac.validation")
public class ValidationProperties {

  /**
   * 校验方式：terraform（调用 CLI）或 heuristic（仅结构与启发式检查）
   */
  private Mode mode = Mode.TERRAFORM;

  /**
   * terraform 可执行文件
   */
  private String terraformBinary = "terraform";

  /**
   * 单条命令超时
   */
  private Duration timeout = Duration.ofSeconds(60);

  /**
   * validate 之前是否执行 init
   */
  private boolean initEnabled = true;

  /**
   * 临时工作目录的父目录，为空时使用系统临时目录
   */
  private String workDirParent;

  public enum Mode {
    TERRAFORM,
    HEURISTIC
  }
}
