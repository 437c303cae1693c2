package com.fabtrack.api.file.dto;

public record UploadResponse(
    String message,
    String category,
    int count,
    int tasksCreated,
    String taskMessage,
    Long lastTaskId
) {
}
