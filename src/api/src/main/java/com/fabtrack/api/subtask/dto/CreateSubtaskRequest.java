package com.fabtrack.api.subtask.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CreateSubtaskRequest(
    @NotBlank(message = "Title is required") String title,
    String status,
    @NotNull(message = "project_id is required")
    @JsonProperty("project_id") @JsonAlias("projectId") Long projectId,
    @NotNull(message = "category_task_id is required")
    @JsonProperty("category_task_id") @JsonAlias("categoryTaskId") Long categoryTaskId,
    String category
) {

  public String statusOrDefault() {
    return status == null || status.isBlank() ? "pending" : status.trim();
  }
}
