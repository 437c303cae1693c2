package com.fabtrack.api.file.dto;

public record FileBlob(String fileName, String mimeType, byte[] data) {
}
