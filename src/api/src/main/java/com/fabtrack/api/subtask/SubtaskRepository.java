package com.fabtrack.api.subtask;

import com.fabtrack.api.subtask.dto.SubtaskDto;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class SubtaskRepository {

  private static final RowMapper<SubtaskDto> ROW = (rs, rowNum) -> new SubtaskDto(
      rs.getLong("id"),
      rs.getString("title"),
      rs.getString("status"),
      rs.getLong("project_id"),
      rs.getLong("category_task_id"),
      rs.getString("category"),
      rs.getObject("created_at", OffsetDateTime.class)
  );

  private final JdbcTemplate jdbc;

  public long insert(String title, String status, long projectId, long categoryTaskId, String category) {
    Long id = jdbc.queryForObject(
        """
        insert into subtasks(title, status, project_id, category_task_id, category)
        values (?,?,?,?,?)
        returning id
        """,
        Long.class,
        title, status, projectId, categoryTaskId, category
    );
    if (id == null) throw new IllegalStateException("insert into subtasks returned no id");
    return id;
  }

  public List<SubtaskDto> listAll() {
    return jdbc.query("select * from subtasks order by id", ROW);
  }

  public List<SubtaskDto> listByTask(long categoryTaskId, String category) {
    if (category == null || category.isBlank()) {
      return jdbc.query("select * from subtasks where category_task_id = ? order by id", ROW, categoryTaskId);
    }
    return jdbc.query(
        "select * from subtasks where category_task_id = ? and lower(category) = lower(?) order by id",
        ROW, categoryTaskId, category.trim());
  }

  public Optional<SubtaskDto> findById(long id) {
    List<SubtaskDto> rows = jdbc.query("select * from subtasks where id = ?", ROW, id);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public int markDone(long id) {
    return jdbc.update("update subtasks set status = 'done' where id = ?", id);
  }

  public int delete(long id) {
    return jdbc.update("delete from subtasks where id = ?", id);
  }

  public int deleteByProject(long projectId) {
    return jdbc.update("delete from subtasks where project_id = ?", projectId);
  }
}
