package com.fabtrack.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FabtrackApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(FabtrackApiApplication.class, args);
  }
}
