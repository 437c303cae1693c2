package com.fabtrack.api.counter;

import com.fabtrack.api.task.CompletionStatusPolicy;
import com.fabtrack.api.task.TaskCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Derives the counter deltas a task mutation requires from the task's state before and after it.
 * Pure: nothing here touches the database.
 */
@Component
@RequiredArgsConstructor
public class CounterTransitions {

  private final CompletionStatusPolicy statusPolicy;

  public List<CounterDelta> onCreate(TaskCategory category, TaskState created) {
    List<CounterDelta> out = new ArrayList<>(2);
    out.add(new CounterDelta(created.projectNo(), category, CounterKind.TOTAL, 1));
    if (statusPolicy.isCompleted(created.status())) {
      out.add(new CounterDelta(created.projectNo(), category, CounterKind.COMPLETED, 1));
    }
    return out;
  }

  public List<CounterDelta> onUpdate(TaskCategory category, TaskState before, TaskState after) {
    boolean wasCompleted = statusPolicy.isCompleted(before.status());
    boolean isCompleted = statusPolicy.isCompleted(after.status());
    List<CounterDelta> out = new ArrayList<>(4);

    if (!Objects.equals(before.projectNo(), after.projectNo())) {
      out.add(new CounterDelta(before.projectNo(), category, CounterKind.TOTAL, -1));
      if (wasCompleted) {
        out.add(new CounterDelta(before.projectNo(), category, CounterKind.COMPLETED, -1));
      }
      out.add(new CounterDelta(after.projectNo(), category, CounterKind.TOTAL, 1));
      if (isCompleted) {
        out.add(new CounterDelta(after.projectNo(), category, CounterKind.COMPLETED, 1));
      }
      return out;
    }

    if (isCompleted && !wasCompleted) {
      out.add(new CounterDelta(after.projectNo(), category, CounterKind.COMPLETED, 1));
    } else if (!isCompleted && wasCompleted) {
      out.add(new CounterDelta(after.projectNo(), category, CounterKind.COMPLETED, -1));
    }
    return out;
  }

  public List<CounterDelta> onDelete(TaskCategory category, TaskState deleted) {
    List<CounterDelta> out = new ArrayList<>(2);
    out.add(new CounterDelta(deleted.projectNo(), category, CounterKind.TOTAL, -1));
    if (statusPolicy.isCompleted(deleted.status())) {
      out.add(new CounterDelta(deleted.projectNo(), category, CounterKind.COMPLETED, -1));
    }
    return out;
  }
}
