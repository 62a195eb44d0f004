package com.evoila.argus.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = "com.evoila.argus")
@EnableConfigurationProperties
public class ArgusApplication {

  public static void main(String[] args) {
    SpringApplication.run(ArgusApplication.class, args);
  }
}
