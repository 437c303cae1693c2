package com.fabtrack.api.task;

import com.fabtrack.api.counter.CounterKind;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskCategoryTest {

  @Test
  void stripCurtainUsesHyphenatedSlugAndUnderscoredIdentifiers() {
    TaskCategory c = TaskCategory.STRIP_CURTAIN;

    assertEquals("strip-curtain", c.slug());
    assertEquals("strip_curtain_tasks", c.table());
    assertEquals("total_strip_curtain", c.column(CounterKind.TOTAL));
    assertEquals("completed_strip_curtain", c.column(CounterKind.COMPLETED));
  }

  @Test
  void resolvesSlugsAndKeys() {
    assertEquals(Optional.of(TaskCategory.STRIP_CURTAIN), TaskCategory.fromSlug("strip-curtain"));
    assertEquals(Optional.of(TaskCategory.STRIP_CURTAIN), TaskCategory.fromKey("strip_curtain"));
    assertEquals(Optional.of(TaskCategory.TRANSPORTATION), TaskCategory.fromKey(" Transportation "));
    assertTrue(TaskCategory.fromSlug("strip_curtain").isEmpty());
  }

  @Test
  void rejectsUnknownValues() {
    assertTrue(TaskCategory.fromSlug("welding").isEmpty());
    assertTrue(TaskCategory.fromKey("projects; drop table projects").isEmpty());
    assertTrue(TaskCategory.fromKey(null).isEmpty());
  }
}
