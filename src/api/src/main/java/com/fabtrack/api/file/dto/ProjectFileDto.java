package com.fabtrack.api.file.dto;

import java.time.OffsetDateTime;

/** File metadata; the content is only served by the blob route. */
public record ProjectFileDto(
    long id,
    String projectNo,
    String fileName,
    long fileSize,
    String mimeType,
    String category,
    Long taskNo,
    OffsetDateTime uploadedAt
) {
}
