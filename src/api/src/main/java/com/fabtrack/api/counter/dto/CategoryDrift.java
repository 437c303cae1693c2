package com.fabtrack.api.counter.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CategoryDrift(
    String category,
    int storedTotal,
    int storedCompleted,
    int liveTotal,
    int liveCompleted
) {

  @JsonProperty("drifted")
  public boolean drifted() {
    return storedTotal != liveTotal || storedCompleted != liveCompleted;
  }
}
