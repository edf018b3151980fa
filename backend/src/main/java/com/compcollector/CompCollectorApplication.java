package com.compcollector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CompCollectorApplication {

  public static void main(String[] args) {
    SpringApplication.run(CompCollectorApplication.class, args);
  }
}
