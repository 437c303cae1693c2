package com.fabtrack.api.task.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record CreateTaskRequest(
    @NotBlank(message = "Title is required") String title,
    String description,
    String priority,
    String status,
    @NotBlank(message = "Project No is required")
    @JsonProperty("project_no") @JsonAlias("projectNo") String projectNo,
    @JsonProperty("due_date") @JsonAlias("dueDate") String dueDate,
    @JsonProperty("approve_status") @JsonAlias("approveStatus") String approveStatus
) {

  public static final String DEFAULT_STATUS = "pending";

  public String statusOrDefault() {
    return status == null || status.isBlank() ? DEFAULT_STATUS : status.trim();
  }
}
