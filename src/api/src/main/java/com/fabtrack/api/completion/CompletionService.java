package com.fabtrack.api.completion;

import com.fabtrack.api.task.CompletionStatusPolicy;
import com.fabtrack.api.task.TaskCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Recomputes completion per category straight from the task tables. It never reads the counter
 * columns, so its output can be compared against them.
 */
@Service
@RequiredArgsConstructor
public class CompletionService {

  private final CompletionRepository repo;
  private final CompletionStatusPolicy statusPolicy;

  /**
   * One entry per category, keyed by {@link TaskCategory#key()} in declaration order. A failing
   * category query aborts the whole calculation.
   */
  public Map<String, CategoryCompletion> calculateCompletion(String projectNo) {
    Map<String, CategoryCompletion> out = new LinkedHashMap<>();
    liveCounts(projectNo).forEach((category, count) ->
        out.put(category.key(), CategoryCompletion.of(count.completed(), count.total())));
    return out;
  }

  public Map<TaskCategory, LiveCount> liveCounts(String projectNo) {
    Map<TaskCategory, LiveCount> out = new EnumMap<>(TaskCategory.class);
    for (TaskCategory category : TaskCategory.values()) {
      out.put(category, repo.count(category, projectNo, statusPolicy.completedValues()));
    }
    return out;
  }

  public static Map<String, CategoryCompletion> zeroFilled() {
    Map<String, CategoryCompletion> out = new LinkedHashMap<>();
    for (TaskCategory category : TaskCategory.values()) {
      out.put(category.key(), CategoryCompletion.EMPTY);
    }
    return out;
  }
}
