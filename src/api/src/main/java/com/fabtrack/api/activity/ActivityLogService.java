package com.fabtrack.api.activity;

import com.fabtrack.api.activity.dto.ActivityLogDto;
import com.fabtrack.api.activity.dto.ActivityLogListResponse;
import com.fabtrack.api.activity.dto.ActivityLogQuery;
import com.fabtrack.api.infra.ResponseJson;
import com.fabtrack.api.infra.tx.TransactionalExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class ActivityLogService {

  private final ActivityLogRepository repo;
  private final ResponseJson responseJson;
  private final TransactionalExecutor tx;
  private final Long defaultUserId;

  public ActivityLogService(ActivityLogRepository repo,
                            ResponseJson responseJson,
                            TransactionalExecutor tx,
                            @Value("${fabtrack.activity.default-user-id:1}") Long defaultUserId) {
    this.repo = repo;
    this.responseJson = responseJson;
    this.tx = tx;
    this.defaultUserId = defaultUserId;
  }

  /**
   * Writes one activity row. A failure here is logged and dropped; it never fails the request that
   * produced the activity.
   */
  public void record(ActivityType type, ResourceType resourceType, Object resourceId, String message,
                     Map<String, ?> details) {
    try {
      String json = responseJson.toJson(details == null ? Map.of() : details);
      tx.savepoint(() -> {
        repo.insert(defaultUserId, type, resourceType, resourceId == null ? null : String.valueOf(resourceId),
            message, json);
        return null;
      });
    } catch (RuntimeException ex) {
      log.error("Activity log write failed: type={} resource={}:{} message={}",
          type, resourceType, resourceId, message, ex);
    }
  }

  public ActivityLogListResponse search(ActivityLogQuery query) {
    List<ActivityLogDto> logs = repo.search(query);
    return new ActivityLogListResponse(
        logs,
        logs.size(),
        "Fetched " + logs.size() + " activity logs, newest first."
    );
  }
}
