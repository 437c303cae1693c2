package com.fabtrack.api.counter;

import com.fabtrack.api.task.TaskCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ProjectCounterRepository {

  private final JdbcTemplate jdbc;

  /** Relative increment in a single statement; returns the number of project rows touched. */
  public int increment(String projectNo, TaskCategory category, CounterKind kind, int delta) {
    String column = category.column(kind);
    return jdbc.update(
        "update projects set " + column + " = " + column + " + ? where project_no = ?",
        delta,
        projectNo
    );
  }

  public Optional<Map<TaskCategory, StoredCounters>> findCounters(String projectNo) {
    return query("select * from projects where project_no = ?", projectNo);
  }

  /** As {@link #findCounters(String)}, locking the project row until the transaction ends. */
  public Optional<Map<TaskCategory, StoredCounters>> lockCounters(String projectNo) {
    return query("select * from projects where project_no = ? for update", projectNo);
  }

  public int overwrite(String projectNo, TaskCategory category, int total, int completed) {
    return jdbc.update(
        "update projects set " + category.totalColumn() + " = ?, " + category.completedColumn() + " = ?"
            + " where project_no = ?",
        total,
        completed,
        projectNo
    );
  }

  private Optional<Map<TaskCategory, StoredCounters>> query(String sql, String projectNo) {
    List<Map<TaskCategory, StoredCounters>> rows = jdbc.query(
        sql,
        (rs, rowNum) -> {
          Map<TaskCategory, StoredCounters> m = new EnumMap<>(TaskCategory.class);
          for (TaskCategory c : TaskCategory.values()) {
            m.put(c, new StoredCounters(rs.getInt(c.totalColumn()), rs.getInt(c.completedColumn())));
          }
          return m;
        },
        projectNo
    );
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }
}
