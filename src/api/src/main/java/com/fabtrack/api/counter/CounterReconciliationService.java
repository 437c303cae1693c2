package com.fabtrack.api.counter;

import com.fabtrack.api.activity.ActivityLogService;
import com.fabtrack.api.activity.ActivityType;
import com.fabtrack.api.activity.ResourceType;
import com.fabtrack.api.completion.CompletionService;
import com.fabtrack.api.completion.LiveCount;
import com.fabtrack.api.counter.dto.CategoryDrift;
import com.fabtrack.api.counter.dto.CounterDriftReport;
import com.fabtrack.api.infra.tx.TransactionalExecutor;
import com.fabtrack.api.project.ProjectNotFoundException;
import com.fabtrack.api.task.TaskCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compares the stored counter columns of a project with counts taken from its task rows, and on
 * request rewrites the stored values.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CounterReconciliationService {

  private final ProjectCounterRepository counters;
  private final CompletionService completionService;
  private final ActivityLogService activityLog;
  private final TransactionalExecutor tx;

  public CounterDriftReport drift(String projectNo) {
    Map<TaskCategory, StoredCounters> stored = counters.findCounters(projectNo)
        .orElseThrow(() -> ProjectNotFoundException.byNo(projectNo));
    return new CounterDriftReport(projectNo, compare(stored, completionService.liveCounts(projectNo)), 0);
  }

  public CounterDriftReport reconcile(String projectNo) {
    return tx.execute(() -> {
      Map<TaskCategory, StoredCounters> stored = counters.lockCounters(projectNo)
          .orElseThrow(() -> ProjectNotFoundException.byNo(projectNo));
      Map<TaskCategory, LiveCount> live = completionService.liveCounts(projectNo);
      List<CategoryDrift> rows = compare(stored, live);

      int corrected = 0;
      for (CategoryDrift d : rows) {
        if (!d.drifted()) continue;
        TaskCategory c = TaskCategory.fromKey(d.category()).orElseThrow();
        counters.overwrite(projectNo, c, d.liveTotal(), d.liveCompleted());
        corrected++;
        log.info("Counter corrected: projectNo={} category={} total {} -> {} completed {} -> {}",
            projectNo, c.key(), d.storedTotal(), d.liveTotal(), d.storedCompleted(), d.liveCompleted());
      }
      if (corrected > 0) {
        activityLog.record(ActivityType.UPDATE, ResourceType.PROJECT, projectNo,
            "Reconciled " + corrected + " counter pair(s) for project " + projectNo,
            Map.of("corrected", corrected));
      }
      return new CounterDriftReport(projectNo, rows, corrected);
    });
  }

  private static List<CategoryDrift> compare(Map<TaskCategory, StoredCounters> stored,
                                             Map<TaskCategory, LiveCount> live) {
    List<CategoryDrift> out = new ArrayList<>();
    for (TaskCategory c : TaskCategory.values()) {
      StoredCounters s = stored.getOrDefault(c, StoredCounters.ZERO);
      LiveCount l = live.getOrDefault(c, new LiveCount(0, 0));
      out.add(new CategoryDrift(c.key(), s.total(), s.completed(), l.total(), l.completed()));
    }
    return out;
  }
}
