package com.fabtrack.api.activity.dto;

import java.time.OffsetDateTime;

public record ActivityLogQuery(
    Long userId,
    String activityType,
    String resourceType,
    String resourceId,
    OffsetDateTime startDate,
    OffsetDateTime endDate,
    int limit,
    int offset
) {

  public static final int DEFAULT_LIMIT = 100;
  public static final int MAX_LIMIT = 500;

  public ActivityLogQuery {
    if (limit <= 0) limit = DEFAULT_LIMIT;
    if (limit > MAX_LIMIT) limit = MAX_LIMIT;
    if (offset < 0) offset = 0;
  }
}
