package com.fabtrack.api.infra;

public record MessageResponse(String message) {
}
