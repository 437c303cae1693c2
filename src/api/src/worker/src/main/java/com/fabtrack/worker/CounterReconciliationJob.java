package com.fabtrack.worker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Periodically recounts every project's tasks and rewrites the {@code total_*}/{@code completed_*}
 * columns that drifted from the task rows.
 *
 * <p>Writes are compare-and-set against the stored values read in the same pass; a counter that
 * moved meanwhile is left for the next run.
 */
@Slf4j
@Component
@EnableScheduling
public class CounterReconciliationJob {

  private final JdbcTemplate jdbc;
  private final CompletedStatuses completedStatuses;

  @Value("${worker.enabled:true}")
  private boolean enabled = true;

  @Value("${worker.reconcile-batch-size:200}")
  private int batchSize = 200;

  @Autowired
  public CounterReconciliationJob(JdbcTemplate jdbc,
                                  @Value("${fabtrack.status.completed-values:completed}") String completedValues) {
    this(jdbc, CompletedStatuses.parse(completedValues));
  }

  public CounterReconciliationJob(JdbcTemplate jdbc, CompletedStatuses completedStatuses) {
    this.jdbc = jdbc;
    this.completedStatuses = completedStatuses;
  }

  public CounterReconciliationJob(JdbcTemplate jdbc) {
    this(jdbc, CompletedStatuses.parse(CompletedStatuses.DEFAULT));
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  @Scheduled(fixedDelayString = "${worker.reconcile-ms:600000}")
  public void tick() {
    if (!enabled) return;
    int corrected = reconcileOnce();
    if (corrected > 0) {
      log.info("Counter reconciliation corrected {} counter pair(s)", corrected);
    } else {
      log.debug("Counter reconciliation found no drift");
    }
  }

  /** One full pass over all projects; returns the number of counter pairs rewritten. */
  @Transactional
  public int reconcileOnce() {
    int corrected = 0;
    long afterId = 0;
    while (true) {
      List<Long> ids = jdbc.queryForList(
          "select id from projects where id > ? order by id limit ?", Long.class, afterId, batchSize);
      if (ids.isEmpty()) break;
      long lastId = ids.get(ids.size() - 1);
      for (CountedCategory category : CountedCategory.values()) {
        corrected += reconcileCategory(category, afterId, lastId);
      }
      afterId = lastId;
      if (ids.size() < batchSize) break;
    }
    return corrected;
  }

  private int reconcileCategory(CountedCategory category, long afterId, long lastId) {
    String total = category.totalColumn();
    String completed = category.completedColumn();
    String table = category.table();
    List<String> completedValues = completedStatuses.values();
    String inList = String.join(",", Collections.nCopies(completedValues.size(), "?"));

    Object[] args = new Object[completedValues.size() + 2];
    for (int i = 0; i < completedValues.size(); i++) args[i] = completedValues.get(i);
    args[completedValues.size()] = afterId;
    args[completedValues.size() + 1] = lastId;

    List<Map<String, Object>> rows = jdbc.queryForList(
        """
        select p.id, p.project_no,
               p.%1$s as stored_total,
               p.%2$s as stored_completed,
               coalesce(t.live_total, 0) as live_total,
               coalesce(t.live_completed, 0) as live_completed
          from projects p
          left join (
            select project_no,
                   count(*) as live_total,
                   count(*) filter (where lower(status) in (%4$s)) as live_completed
              from %3$s
             group by project_no
          ) t on t.project_no = p.project_no
         where p.id > ? and p.id <= ?
         order by p.id
        """.formatted(total, completed, table, inList),
        args
    );

    int corrected = 0;
    for (Map<String, Object> r : rows) {
      int storedTotal = ((Number) r.get("stored_total")).intValue();
      int storedCompleted = ((Number) r.get("stored_completed")).intValue();
      int liveTotal = ((Number) r.get("live_total")).intValue();
      int liveCompleted = ((Number) r.get("live_completed")).intValue();
      if (storedTotal == liveTotal && storedCompleted == liveCompleted) continue;

      long id = ((Number) r.get("id")).longValue();
      String projectNo = Objects.toString(r.get("project_no"));
      int updated = jdbc.update(
          "update projects set %1$s = ?, %2$s = ? where id = ? and %1$s = ? and %2$s = ?".formatted(total, completed),
          liveTotal, liveCompleted, id, storedTotal, storedCompleted);
      if (updated == 0) {
        log.info("Counters moved during reconciliation, skipping: projectNo={} category={}", projectNo, category.key());
        continue;
      }
      corrected++;
      log.info("Counter drift corrected: projectNo={} category={} total {} -> {} completed {} -> {}",
          projectNo, category.key(), storedTotal, liveTotal, storedCompleted, liveCompleted);
    }
    return corrected;
  }
}
