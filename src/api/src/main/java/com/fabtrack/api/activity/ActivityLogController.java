package com.fabtrack.api.activity;

import com.fabtrack.api.activity.dto.ActivityLogListResponse;
import com.fabtrack.api.activity.dto.ActivityLogQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/activity-logs")
public class ActivityLogController {

  private final ActivityLogService service;

  @GetMapping
  public ActivityLogListResponse list(
      @RequestParam(required = false) Long userId,
      @RequestParam(required = false) String activityType,
      @RequestParam(required = false) String resourceType,
      @RequestParam(required = false) String resourceId,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime startDate,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime endDate,
      @RequestParam(defaultValue = "100") int limit,
      @RequestParam(defaultValue = "0") int offset) {
    return service.search(new ActivityLogQuery(
        userId, activityType, resourceType, resourceId, startDate, endDate, limit, offset));
  }
}
