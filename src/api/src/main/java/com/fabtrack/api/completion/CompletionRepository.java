package com.fabtrack.api.completion;

import com.fabtrack.api.task.TaskCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class CompletionRepository {

  private final JdbcTemplate jdbc;

  /**
   * Counts the category's task rows for one project. {@code completedValues} must already be
   * lower-cased.
   */
  public LiveCount count(TaskCategory category, String projectNo, List<String> completedValues) {
    String placeholders = String.join(",", Collections.nCopies(completedValues.size(), "?"));
    List<Object> args = new ArrayList<>(completedValues);
    args.add(projectNo);
    return jdbc.queryForObject(
        "select count(*) as total,"
            + " count(*) filter (where lower(status) in (" + placeholders + ")) as completed"
            + " from " + category.table()
            + " where project_no = ?",
        (rs, rowNum) -> new LiveCount(rs.getInt("total"), rs.getInt("completed")),
        args.toArray()
    );
  }
}
