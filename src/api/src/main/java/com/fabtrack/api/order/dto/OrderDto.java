package com.fabtrack.api.order.dto;

import java.time.OffsetDateTime;
import java.util.List;

public record OrderDto(
    long id,
    long taskId,
    String projectNo,
    String taskTitle,
    List<OrderItem> items,
    String status,
    String category,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {
}
