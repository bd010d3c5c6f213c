package com.evoila.rosetta.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = "com.evoila.rosetta")
@EnableConfigurationProperties
public class RosettaApplication {

  public static void main(String[] args) {
    SpringApplication.run(RosettaApplication.class, args);
  }
}
