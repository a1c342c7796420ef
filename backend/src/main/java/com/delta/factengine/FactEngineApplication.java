package com.delta.factengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FactEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(FactEngineApplication.class, args);
  }
}
