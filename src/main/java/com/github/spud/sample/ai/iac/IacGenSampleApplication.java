package com.github.spud.sample.ai.iac;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IacGenSampleApplication {

  public static void main(String[] args) {
    SpringApplication.run(IacGenSampleApplication.class, args);
  }

}
