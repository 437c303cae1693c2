package com.fabtrack.api.file;

import com.fabtrack.api.file.dto.FileBlob;
import com.fabtrack.api.file.dto.ProjectFileDto;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ProjectFileRepository {

  private static final String META_COLUMNS =
      "id, project_no, file_name, file_size, mime_type, category, task_no, uploaded_at";

  private static final RowMapper<ProjectFileDto> META = (rs, rowNum) -> new ProjectFileDto(
      rs.getLong("id"),
      rs.getString("project_no"),
      rs.getString("file_name"),
      rs.getLong("file_size"),
      rs.getString("mime_type"),
      rs.getString("category"),
      rs.getObject("task_no", Long.class),
      rs.getObject("uploaded_at", OffsetDateTime.class)
  );

  private final JdbcTemplate jdbc;

  public long insert(String projectNo, String fileName, long size, String mimeType, byte[] data, String category) {
    Long id = jdbc.queryForObject(
        """
        insert into project_files(project_no, file_name, file_size, mime_type, file_data, category)
        values (?,?,?,?,?,?)
        returning id
        """,
        Long.class,
        projectNo, fileName, size, mimeType, data, category
    );
    if (id == null) throw new IllegalStateException("insert into project_files returned no id");
    return id;
  }

  public void linkTask(long fileId, long taskId) {
    jdbc.update("update project_files set task_no = ? where id = ?", taskId, fileId);
  }

  /** {@code category} null or {@code all} lists every file of the project. */
  public List<ProjectFileDto> list(String projectNo, String category) {
    StringBuilder sql = new StringBuilder("select " + META_COLUMNS + " from project_files where project_no = ?");
    List<Object> args = new ArrayList<>();
    args.add(projectNo);
    if (category != null && !category.isBlank() && !"all".equalsIgnoreCase(category)) {
      sql.append(" and category = ?");
      args.add(category);
    }
    sql.append(" order by uploaded_at desc, id desc");
    return jdbc.query(sql.toString(), META, args.toArray());
  }

  public Optional<ProjectFileDto> findById(long id) {
    List<ProjectFileDto> rows = jdbc.query(
        "select " + META_COLUMNS + " from project_files where id = ?", META, id);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public Optional<FileBlob> findBlob(long id) {
    List<FileBlob> rows = jdbc.query(
        "select file_name, mime_type, file_data from project_files where id = ?",
        (rs, rowNum) -> new FileBlob(rs.getString("file_name"), rs.getString("mime_type"), rs.getBytes("file_data")),
        id
    );
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public int delete(long id) {
    return jdbc.update("delete from project_files where id = ?", id);
  }

  public int deleteByProject(String projectNo) {
    return jdbc.update("delete from project_files where project_no = ?", projectNo);
  }

  public int reassignProject(String fromProjectNo, String toProjectNo) {
    return jdbc.update("update project_files set project_no = ? where project_no = ?", toProjectNo, fromProjectNo);
  }
}
