package com.fabtrack.worker;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CompletedStatusesTest {

  @Test
  void blankConfigurationFallsBackToCompleted() {
    assertEquals(List.of("completed"), CompletedStatuses.parse(null).values());
    assertEquals(List.of("completed"), CompletedStatuses.parse(" , ").values());
  }

  @Test
  void valuesAreTrimmedLowerCasedAndDeduplicated() {
    assertEquals(List.of("completed", "done"), CompletedStatuses.parse("Completed, DONE ,completed").values());
  }

  @Test
  void categoryIdentifiersFollowTheSchema() {
    assertEquals("strip_curtain_tasks", CountedCategory.STRIP_CURTAIN.table());
    assertEquals("total_strip_curtain", CountedCategory.STRIP_CURTAIN.totalColumn());
    assertEquals("completed_quotation", CountedCategory.QUOTATION.completedColumn());
    assertEquals(8, CountedCategory.values().length);
  }
}
