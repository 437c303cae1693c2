package com.fabtrack.api.task.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;

public record TaskDto(
    long id,
    String title,
    String description,
    String priority,
    String status,
    String projectNo,
    LocalDate dueDate,
    OffsetDateTime createdAt,
    String approveStatus
) {
}
