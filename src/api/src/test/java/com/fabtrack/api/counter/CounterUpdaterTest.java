package com.fabtrack.api.counter;

import com.fabtrack.api.infra.tx.TransactionalExecutor;
import com.fabtrack.api.task.TaskCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CounterUpdaterTest {

  private ProjectCounterRepository counters;
  private CounterUpdater updater;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    counters = mock(ProjectCounterRepository.class);
    TransactionalExecutor tx = mock(TransactionalExecutor.class);
    when(tx.savepoint(any())).thenAnswer(inv -> ((Supplier<Object>) inv.getArgument(0)).get());
    updater = new CounterUpdater(counters, tx);
  }

  @Test
  void appliesDeltaToResolvedColumn() {
    when(counters.increment("P-1", TaskCategory.PANEL, CounterKind.TOTAL, 1)).thenReturn(1);

    assertTrue(updater.adjustCount("P-1", TaskCategory.PANEL, CounterKind.TOTAL, 1));
    verify(counters).increment("P-1", TaskCategory.PANEL, CounterKind.TOTAL, 1);
  }

  @Test
  void normalisesDeltaToItsSign() {
    when(counters.increment(any(), any(), any(), anyInt())).thenReturn(1);

    updater.adjustCount("P-1", TaskCategory.DOOR, CounterKind.COMPLETED, -5);

    verify(counters).increment("P-1", TaskCategory.DOOR, CounterKind.COMPLETED, -1);
  }

  @Test
  void missingProjectIsNoOp() {
    when(counters.increment(any(), any(), any(), anyInt())).thenReturn(0);

    assertFalse(updater.adjustCount("nope", TaskCategory.SYSTEM, CounterKind.TOTAL, 1));
  }

  @Test
  void databaseErrorIsSwallowed() {
    when(counters.increment(any(), any(), any(), anyInt()))
        .thenThrow(new DataAccessResourceFailureException("connection reset"));

    assertFalse(updater.adjustCount("P-1", TaskCategory.CUTTING, CounterKind.TOTAL, -1));
  }

  @Test
  void applyCountsOnlySuccessfulAdjustments() {
    when(counters.increment(eq("A"), any(), any(), anyInt())).thenReturn(1);
    when(counters.increment(eq("B"), any(), any(), anyInt())).thenReturn(0);

    int applied = updater.apply(List.of(
        new CounterDelta("A", TaskCategory.PANEL, CounterKind.TOTAL, -1),
        new CounterDelta("B", TaskCategory.PANEL, CounterKind.TOTAL, 1)
    ));

    assertEquals(1, applied);
  }
}
