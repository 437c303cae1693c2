package com.fabtrack.api.order.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record CreateOrderRequest(
    @NotNull(message = "task_id is required")
    @JsonProperty("task_id") @JsonAlias("taskId") Long taskId,
    @NotBlank(message = "project_no is required")
    @JsonProperty("project_no") @JsonAlias("projectNo") String projectNo,
    @NotBlank(message = "task_title is required")
    @JsonProperty("task_title") @JsonAlias("taskTitle") String taskTitle,
    @NotNull(message = "items array is required") @Valid List<OrderItem> items,
    String status,
    String category
) {

  public String statusOrDefault() {
    return status == null || status.isBlank() ? "pending" : status.trim();
  }

  public String categoryOrDefault() {
    return category == null || category.isBlank() ? "Accessories" : category.trim();
  }
}
