package com.fabtrack.api.task;

import com.fabtrack.api.task.dto.TaskDto;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Repository
@RequiredArgsConstructor
public class TaskRepository {

  private static final String COLUMNS =
      "id, title, description, priority, status, project_no, due_date, created_at, approve_status";

  /** Columns a partial update may touch. */
  static final Set<String> UPDATABLE = Set.of(
      "title", "description", "priority", "status", "project_no", "due_date", "approve_status");

  private static final RowMapper<TaskDto> ROW = (rs, rowNum) -> {
    Date due = rs.getDate("due_date");
    return new TaskDto(
        rs.getLong("id"),
        rs.getString("title"),
        rs.getString("description"),
        rs.getString("priority"),
        rs.getString("status"),
        rs.getString("project_no"),
        due == null ? null : due.toLocalDate(),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getString("approve_status")
    );
  };

  private final JdbcTemplate jdbc;

  public List<TaskDto> list(TaskCategory category, String projectNo, String approveStatus) {
    StringBuilder sql = new StringBuilder("select " + COLUMNS + " from " + category.table() + " where 1=1");
    List<Object> args = new ArrayList<>();
    if (projectNo != null && !projectNo.isBlank()) {
      sql.append(" and project_no = ?");
      args.add(projectNo.trim());
    }
    if (approveStatus != null && !approveStatus.isBlank()) {
      sql.append(" and lower(approve_status) = lower(?)");
      args.add(approveStatus.trim());
    }
    sql.append(" order by created_at desc, id desc");
    return jdbc.query(sql.toString(), ROW, args.toArray());
  }

  public Optional<TaskDto> findById(TaskCategory category, long id) {
    List<TaskDto> rows = jdbc.query(
        "select " + COLUMNS + " from " + category.table() + " where id = ?", ROW, id);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /** Reads the row and locks it until the surrounding transaction ends. */
  public Optional<TaskDto> lockById(TaskCategory category, long id) {
    List<TaskDto> rows = jdbc.query(
        "select " + COLUMNS + " from " + category.table() + " where id = ? for update", ROW, id);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public long insert(TaskCategory category, NewTask task) {
    Long id = jdbc.queryForObject(
        """
        insert into %s(title, description, priority, status, project_no, due_date, approve_status)
        values (?,?,?,?,?,?,?)
        returning id
        """.formatted(category.table()),
        Long.class,
        task.title(),
        task.description(),
        task.priority(),
        task.status(),
        task.projectNo(),
        task.dueDate() == null ? null : Date.valueOf(task.dueDate()),
        task.approveStatus()
    );
    if (id == null) throw new IllegalStateException("insert into " + category.table() + " returned no id");
    return id;
  }

  public int update(TaskCategory category, long id, Map<String, Object> columns) {
    List<String> sets = new ArrayList<>();
    List<Object> args = new ArrayList<>();
    for (Map.Entry<String, Object> e : columns.entrySet()) {
      if (!UPDATABLE.contains(e.getKey())) {
        throw new IllegalArgumentException("Not an updatable task column: " + e.getKey());
      }
      sets.add(e.getKey() + " = ?");
      Object v = e.getValue();
      args.add(v instanceof LocalDate d ? Date.valueOf(d) : v);
    }
    if (sets.isEmpty()) return 0;
    args.add(id);
    return jdbc.update(
        "update " + category.table() + " set " + String.join(", ", sets) + " where id = ?",
        args.toArray());
  }

  public int delete(TaskCategory category, long id) {
    return jdbc.update("delete from " + category.table() + " where id = ?", id);
  }

  /** Moves every task of a project to a renamed project number. */
  public int reassignProject(TaskCategory category, String fromProjectNo, String toProjectNo) {
    return jdbc.update(
        "update " + category.table() + " set project_no = ? where project_no = ?", toProjectNo, fromProjectNo);
  }

  public int deleteByProject(TaskCategory category, String projectNo) {
    return jdbc.update("delete from " + category.table() + " where project_no = ?", projectNo);
  }
}
