package com.fabtrack.api.activity.dto;

import java.time.OffsetDateTime;

public record ActivityLogDto(
    long id,
    OffsetDateTime timestamp,
    Long userId,
    String activityType,
    String resourceType,
    String resourceId,
    String message,
    String details
) {
}
