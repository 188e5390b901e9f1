package com.lookupgate.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "com.lookupgate.api")
public class LookupGateApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(LookupGateApiApplication.class, args);
  }
}
