package com.fabtrack.api.task.dto;

import com.fabtrack.api.task.TaskDates;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

public record UpdateTaskRequest(
    String title,
    String description,
    String priority,
    String status,
    @JsonProperty("project_no") @JsonAlias("projectNo") String projectNo,
    @JsonProperty("due_date") @JsonAlias("dueDate") String dueDate,
    @JsonProperty("approve_status") @JsonAlias("approveStatus") String approveStatus
) {

  /**
   * Column name to new value for every field present in the request. An empty description or due
   * date clears the column.
   */
  public Map<String, Object> changedColumns() {
    Map<String, Object> m = new LinkedHashMap<>();
    if (title != null) m.put("title", title);
    if (description != null) m.put("description", description.isEmpty() ? null : description);
    if (priority != null) m.put("priority", priority);
    if (status != null) m.put("status", status.trim());
    if (projectNo != null) m.put("project_no", projectNo.trim());
    if (dueDate != null) m.put("due_date", TaskDates.parseOrNull(dueDate));
    if (approveStatus != null) m.put("approve_status", approveStatus);
    return m;
  }
}
