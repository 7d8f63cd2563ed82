package com.delta.jobmatcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DeltaJobMatcherApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeltaJobMatcherApplication.class, args);
  }
}
