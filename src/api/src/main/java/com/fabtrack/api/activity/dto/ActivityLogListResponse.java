package com.fabtrack.api.activity.dto;

import java.util.List;

public record ActivityLogListResponse(List<ActivityLogDto> data, int count, String message) {
}
