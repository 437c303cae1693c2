package com.fabtrack.api.task;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "fabtrack.status")
public record CompletionStatusProperties(List<String> completedValues) {

  public CompletionStatusProperties {
    if (completedValues == null || completedValues.isEmpty()) {
      completedValues = List.of("completed");
    }
  }
}
