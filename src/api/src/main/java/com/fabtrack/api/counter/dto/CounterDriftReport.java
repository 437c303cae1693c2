package com.fabtrack.api.counter.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Stored vs. live counters of one project; {@code corrected} is 0 for a read-only check. */
public record CounterDriftReport(
    String projectNo,
    List<CategoryDrift> categories,
    int corrected
) {

  @JsonProperty("drifted")
  public boolean drifted() {
    return categories.stream().anyMatch(CategoryDrift::drifted);
  }
}
