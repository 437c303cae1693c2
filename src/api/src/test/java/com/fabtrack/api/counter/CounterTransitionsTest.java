package com.fabtrack.api.counter;

import com.fabtrack.api.task.CompletionStatusPolicy;
import com.fabtrack.api.task.CompletionStatusProperties;
import com.fabtrack.api.task.TaskCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CounterTransitionsTest {

  private final CounterTransitions transitions =
      new CounterTransitions(new CompletionStatusPolicy(new CompletionStatusProperties(null)));

  @Test
  void createPending_incrementsTotalOnly() {
    List<CounterDelta> d = transitions.onCreate(TaskCategory.DOOR, new TaskState("P-1", "pending"));

    assertEquals(List.of(new CounterDelta("P-1", TaskCategory.DOOR, CounterKind.TOTAL, 1)), d);
  }

  @Test
  void createCompleted_incrementsBoth() {
    List<CounterDelta> d = transitions.onCreate(TaskCategory.PANEL, new TaskState("P-1", "Completed"));

    assertEquals(List.of(
        new CounterDelta("P-1", TaskCategory.PANEL, CounterKind.TOTAL, 1),
        new CounterDelta("P-1", TaskCategory.PANEL, CounterKind.COMPLETED, 1)
    ), d);
  }

  @Test
  void updateIntoCompleted_incrementsCompleted() {
    List<CounterDelta> d = transitions.onUpdate(TaskCategory.PANEL,
        new TaskState("P-1", "pending"), new TaskState("P-1", "COMPLETED"));

    assertEquals(List.of(new CounterDelta("P-1", TaskCategory.PANEL, CounterKind.COMPLETED, 1)), d);
  }

  @Test
  void updateOutOfCompleted_decrementsCompleted() {
    List<CounterDelta> d = transitions.onUpdate(TaskCategory.CUTTING,
        new TaskState("P-1", "completed"), new TaskState("P-1", "in progress"));

    assertEquals(List.of(new CounterDelta("P-1", TaskCategory.CUTTING, CounterKind.COMPLETED, -1)), d);
  }

  @Test
  void updateBetweenCompletedSpellings_isNoOp() {
    assertTrue(transitions.onUpdate(TaskCategory.SYSTEM,
        new TaskState("P-1", "Completed"), new TaskState("P-1", "completed")).isEmpty());
    assertTrue(transitions.onUpdate(TaskCategory.SYSTEM,
        new TaskState("P-1", "pending"), new TaskState("P-1", "in progress")).isEmpty());
  }

  @Test
  void reassignCompletedTask_movesBothCounters() {
    List<CounterDelta> d = transitions.onUpdate(TaskCategory.ACCESSORIES,
        new TaskState("A", "completed"), new TaskState("B", "completed"));

    assertEquals(List.of(
        new CounterDelta("A", TaskCategory.ACCESSORIES, CounterKind.TOTAL, -1),
        new CounterDelta("A", TaskCategory.ACCESSORIES, CounterKind.COMPLETED, -1),
        new CounterDelta("B", TaskCategory.ACCESSORIES, CounterKind.TOTAL, 1),
        new CounterDelta("B", TaskCategory.ACCESSORIES, CounterKind.COMPLETED, 1)
    ), d);
  }

  @Test
  void reassignAndComplete_addsCompletedOnlyOnTarget() {
    List<CounterDelta> d = transitions.onUpdate(TaskCategory.STRIP_CURTAIN,
        new TaskState("A", "pending"), new TaskState("B", "Completed"));

    assertEquals(List.of(
        new CounterDelta("A", TaskCategory.STRIP_CURTAIN, CounterKind.TOTAL, -1),
        new CounterDelta("B", TaskCategory.STRIP_CURTAIN, CounterKind.TOTAL, 1),
        new CounterDelta("B", TaskCategory.STRIP_CURTAIN, CounterKind.COMPLETED, 1)
    ), d);
  }

  @Test
  void deleteCompleted_decrementsBoth() {
    List<CounterDelta> d = transitions.onDelete(TaskCategory.QUOTATION, new TaskState("P-9", "COMPLETED"));

    assertEquals(List.of(
        new CounterDelta("P-9", TaskCategory.QUOTATION, CounterKind.TOTAL, -1),
        new CounterDelta("P-9", TaskCategory.QUOTATION, CounterKind.COMPLETED, -1)
    ), d);
  }

  @Test
  void doneHasNoCounterSignificanceByDefault() {
    assertEquals(List.of(new CounterDelta("P-1", TaskCategory.DOOR, CounterKind.TOTAL, 1)),
        transitions.onCreate(TaskCategory.DOOR, new TaskState("P-1", "Done")));
    assertEquals(List.of(new CounterDelta("P-1", TaskCategory.DOOR, CounterKind.COMPLETED, -1)),
        transitions.onUpdate(TaskCategory.DOOR, new TaskState("P-1", "completed"), new TaskState("P-1", "done")));
  }

  @Test
  void createThenDelete_netsToZero() {
    TaskState s = new TaskState("P-2", "completed");
    int total = 0;
    int completed = 0;
    for (CounterDelta d : transitions.onCreate(TaskCategory.TRANSPORTATION, s)) {
      if (d.kind() == CounterKind.TOTAL) total += d.delta(); else completed += d.delta();
    }
    for (CounterDelta d : transitions.onDelete(TaskCategory.TRANSPORTATION, s)) {
      if (d.kind() == CounterKind.TOTAL) total += d.delta(); else completed += d.delta();
    }
    assertEquals(0, total);
    assertEquals(0, completed);
  }
}
