package com.fabtrack.api.file.dto;

public record FileDeleteResponse(
    String message,
    long fileId,
    boolean taskDeleted,
    Long taskNo
) {
}
