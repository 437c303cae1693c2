package com.fabtrack.api.counter;

import com.fabtrack.api.infra.tx.TransactionalExecutor;
import com.fabtrack.api.task.TaskCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.List;

/**
 * Applies counter deltas to the {@code projects} counter columns.
 *
 * <p>Counter maintenance never fails the task operation that triggered it: a missing project row or
 * a database error is logged and reported as {@code false}. Each adjustment runs in its own savepoint
 * so a failed statement does not abort the caller's transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CounterUpdater {

  private final ProjectCounterRepository counters;
  private final TransactionalExecutor tx;

  public boolean adjustCount(String projectNo, TaskCategory category, CounterKind kind, int delta) {
    int step = delta > 0 ? 1 : -1;
    try {
      Integer updated = tx.savepoint(() -> counters.increment(projectNo, category, kind, step));
      if (updated == null || updated == 0) {
        log.warn("Counter not applied, no project row: projectNo={} category={} counter={} delta={}",
            projectNo, category.key(), kind, step);
        return false;
      }
      log.debug("Counter applied: projectNo={} column={} delta={}", projectNo, category.column(kind), step);
      return true;
    } catch (DataAccessException | TransactionException ex) {
      log.error("Counter update failed: projectNo={} category={} counter={} delta={}",
          projectNo, category.key(), kind, step, ex);
      return false;
    }
  }

  /** Applies deltas in order; returns how many took effect. */
  public int apply(List<CounterDelta> deltas) {
    int applied = 0;
    for (CounterDelta d : deltas) {
      if (adjustCount(d.projectNo(), d.category(), d.kind(), d.delta())) {
        applied++;
      }
    }
    return applied;
  }
}
