package com.fabtrack.api.project;

import com.fabtrack.api.counter.StoredCounters;
import com.fabtrack.api.project.dto.CreateProjectRequest;
import com.fabtrack.api.project.dto.ProjectDto;
import com.fabtrack.api.task.TaskCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Repository
@RequiredArgsConstructor
public class ProjectRepository {

  static final Set<String> UPDATABLE = Set.of(
      "drawing_date", "project_no", "customer", "po_payment", "requested_delivery", "remark",
      "project_name", "salesman");

  private static final RowMapper<ProjectDto> ROW = (rs, rowNum) -> {
    Map<String, StoredCounters> counters = new LinkedHashMap<>();
    for (TaskCategory c : TaskCategory.values()) {
      counters.put(c.key(), new StoredCounters(rs.getInt(c.totalColumn()), rs.getInt(c.completedColumn())));
    }
    return new ProjectDto(
        rs.getLong("id"),
        rs.getString("project_no"),
        rs.getString("project_name"),
        rs.getString("customer"),
        rs.getString("salesman"),
        toLocalDate(rs.getDate("drawing_date")),
        rs.getString("po_payment"),
        toLocalDate(rs.getDate("requested_delivery")),
        rs.getString("remark"),
        rs.getString("status"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class),
        counters,
        null
    );
  };

  private final JdbcTemplate jdbc;

  public List<ProjectDto> listAll() {
    return jdbc.query("select * from projects order by created_at desc, id desc", ROW);
  }

  public List<ProjectDto> listByStatus(String status) {
    return jdbc.query(
        "select * from projects where lower(status) = lower(?) order by created_at desc, id desc",
        ROW, status);
  }

  public Optional<ProjectDto> findById(long id) {
    List<ProjectDto> rows = jdbc.query("select * from projects where id = ?", ROW, id);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public Optional<ProjectDto> findByProjectNo(String projectNo) {
    List<ProjectDto> rows = jdbc.query("select * from projects where project_no = ?", ROW, projectNo);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public boolean existsByProjectNo(String projectNo) {
    Integer n = jdbc.queryForObject("select count(*) from projects where project_no = ?", Integer.class, projectNo);
    return n != null && n > 0;
  }

  /** Inserts the row, seeding completed counters from {@code initialCompleted}; returns the new id. */
  public long insert(String projectNo, CreateProjectRequest req, Map<TaskCategory, Integer> initialCompleted) {
    List<String> columns = new ArrayList<>(List.of(
        "project_no", "project_name", "customer", "salesman", "drawing_date", "po_payment",
        "requested_delivery", "remark", "status"));
    List<Object> args = new ArrayList<>();
    args.add(projectNo);
    args.add(req.projectName() == null ? "" : req.projectName());
    args.add(req.customer().trim());
    args.add(req.salesman() == null ? "" : req.salesman());
    args.add(toSqlDate(req.drawingDate()));
    args.add(req.poPayment());
    args.add(toSqlDate(req.requestedDelivery()));
    args.add(req.remark());
    args.add(req.statusOrDefault());
    initialCompleted.forEach((category, value) -> {
      columns.add(category.completedColumn());
      args.add(value);
    });

    String placeholders = String.join(",", Collections.nCopies(columns.size(), "?"));
    Long id = jdbc.queryForObject(
        "insert into projects(" + String.join(", ", columns) + ") values (" + placeholders + ") returning id",
        Long.class, args.toArray());
    if (id == null) throw new IllegalStateException("insert into projects returned no id");
    return id;
  }

  public int update(long id, Map<String, Object> columns) {
    List<String> sets = new ArrayList<>();
    List<Object> args = new ArrayList<>();
    for (Map.Entry<String, Object> e : columns.entrySet()) {
      if (!UPDATABLE.contains(e.getKey())) {
        throw new IllegalArgumentException("Not an updatable project column: " + e.getKey());
      }
      sets.add(e.getKey() + " = ?");
      Object v = e.getValue();
      args.add(v instanceof LocalDate d ? Date.valueOf(d) : v);
    }
    if (sets.isEmpty()) return 0;
    args.add(id);
    return jdbc.update(
        "update projects set " + String.join(", ", sets) + ", updated_at = now() where id = ?",
        args.toArray());
  }

  public int updateStatus(long id, String status) {
    return jdbc.update("update projects set status = ?, updated_at = now() where id = ?", status, id);
  }

  public int delete(long id) {
    return jdbc.update("delete from projects where id = ?", id);
  }

  private static LocalDate toLocalDate(Date d) {
    return d == null ? null : d.toLocalDate();
  }

  private static Date toSqlDate(LocalDate d) {
    return d == null ? null : Date.valueOf(d);
  }
}
