package com.fabtrack.api.order;

import com.fabtrack.api.infra.ResponseJson;
import com.fabtrack.api.order.dto.OrderDto;
import com.fabtrack.api.order.dto.OrderItem;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class OrderRepository {

  private static final TypeReference<List<OrderItem>> ITEMS = new TypeReference<>() {
  };

  private final JdbcTemplate jdbc;
  private final ResponseJson json;

  private OrderDto map(ResultSet rs, int rowNum) throws SQLException {
    return new OrderDto(
        rs.getLong("id"),
        rs.getLong("task_id"),
        rs.getString("project_no"),
        rs.getString("task_title"),
        json.fromJson(rs.getString("items"), ITEMS),
        rs.getString("status"),
        rs.getString("category"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );
  }

  public long insert(long taskId, String projectNo, String taskTitle, List<OrderItem> items, String status,
                     String category) {
    Long id = jdbc.queryForObject(
        """
        insert into orders(task_id, project_no, task_title, items, status, category)
        values (?,?,?,?::jsonb,?,?)
        returning id
        """,
        Long.class,
        taskId, projectNo, taskTitle, json.toJson(items), status, category
    );
    if (id == null) throw new IllegalStateException("insert into orders returned no id");
    return id;
  }

  public List<OrderDto> listAll() {
    return jdbc.query("select * from orders order by created_at desc, id desc", this::map);
  }

  public List<OrderDto> listByTask(long taskId) {
    return jdbc.query("select * from orders where task_id = ? order by created_at desc, id desc", this::map, taskId);
  }

  public Optional<OrderDto> findById(long id) {
    List<OrderDto> rows = jdbc.query("select * from orders where id = ?", this::map, id);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public int updateStatus(long id, String status) {
    return jdbc.update("update orders set status = ?, updated_at = now() where id = ?", status, id);
  }

  public int delete(long id) {
    return jdbc.update("delete from orders where id = ?", id);
  }
}
