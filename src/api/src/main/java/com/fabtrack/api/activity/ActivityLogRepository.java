package com.fabtrack.api.activity;

import com.fabtrack.api.activity.dto.ActivityLogDto;
import com.fabtrack.api.activity.dto.ActivityLogQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class ActivityLogRepository {

  private final JdbcTemplate jdbc;

  public void insert(Long userId,
                     ActivityType activityType,
                     ResourceType resourceType,
                     String resourceId,
                     String message,
                     String detailsJson) {
    jdbc.update(
        """
        insert into activity_logs(user_id, activity_type, resource_type, resource_id, message, details)
        values (?,?,?,?,?, ?::jsonb)
        """,
        userId,
        activityType.name(),
        resourceType.name(),
        resourceId,
        message,
        detailsJson
    );
  }

  public List<ActivityLogDto> search(ActivityLogQuery q) {
    StringBuilder sql = new StringBuilder(
        "select id, logged_at, user_id, activity_type, resource_type, resource_id, message, details::text as details"
            + " from activity_logs where 1=1");
    List<Object> args = new ArrayList<>();

    if (q.userId() != null) {
      sql.append(" and user_id = ?");
      args.add(q.userId());
    }
    if (q.activityType() != null && !q.activityType().isBlank()) {
      sql.append(" and activity_type = ?");
      args.add(q.activityType().trim().toUpperCase());
    }
    if (q.resourceType() != null && !q.resourceType().isBlank()) {
      sql.append(" and resource_type = ?");
      args.add(q.resourceType().trim().toUpperCase());
    }
    if (q.resourceId() != null && !q.resourceId().isBlank()) {
      sql.append(" and resource_id = ?");
      args.add(q.resourceId().trim());
    }
    if (q.startDate() != null) {
      sql.append(" and logged_at >= ?");
      args.add(q.startDate());
    }
    if (q.endDate() != null) {
      sql.append(" and logged_at <= ?");
      args.add(q.endDate());
    }
    sql.append(" order by logged_at desc, id desc limit ? offset ?");
    args.add(q.limit());
    args.add(q.offset());

    return jdbc.query(
        sql.toString(),
        (rs, rowNum) -> new ActivityLogDto(
            rs.getLong("id"),
            rs.getObject("logged_at", OffsetDateTime.class),
            (Long) rs.getObject("user_id"),
            rs.getString("activity_type"),
            rs.getString("resource_type"),
            rs.getString("resource_id"),
            rs.getString("message"),
            rs.getString("details")
        ),
        args.toArray()
    );
  }
}
