package com.fabtrack.api.subtask.dto;

import java.time.OffsetDateTime;

public record SubtaskDto(
    long id,
    String title,
    String status,
    long projectId,
    long categoryTaskId,
    String category,
    OffsetDateTime createdAt
) {
}
