package com.fabtrack.api.completion;

public record LiveCount(int total, int completed) {
}
