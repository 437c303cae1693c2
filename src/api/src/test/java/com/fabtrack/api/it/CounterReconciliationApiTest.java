package com.fabtrack.api.it;

import com.fabtrack.api.task.TaskCategory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CounterReconciliationApiTest extends IntegrationTestBase {

  @Test
  void consistentProjectReportsNoDrift() throws Exception {
    String p = newProjectNo("NODRIFT");
    createProject(p);
    createTask(TaskCategory.SYSTEM, p, "pending");
    createTask(TaskCategory.SYSTEM, p, "COMPLETED");

    mvc.perform(get("/api/projects/" + p + "/counters/drift"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.drifted").value(false))
        .andExpect(jsonPath("$.categories.length()").value(TaskCategory.values().length))
        .andExpect(jsonPath("$.categories[?(@.category == 'system')].liveTotal").value(2))
        .andExpect(jsonPath("$.categories[?(@.category == 'system')].liveCompleted").value(1));
  }

  @Test
  void reconcileRewritesDriftedCounters() throws Exception {
    String p = newProjectNo("DRIFT");
    createProject(p);
    createTask(TaskCategory.CUTTING, p, "completed");
    createTask(TaskCategory.CUTTING, p, "pending");
    createTask(TaskCategory.STRIP_CURTAIN, p, "pending");

    jdbc.update("update projects set total_cutting = 7, completed_cutting = 5, total_strip_curtain = 0 where project_no = ?", p);

    mvc.perform(get("/api/projects/" + p + "/counters/drift"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.drifted").value(true))
        .andExpect(jsonPath("$.corrected").value(0));
    assertEquals(7, total(p, TaskCategory.CUTTING));

    mvc.perform(post("/api/projects/" + p + "/counters/reconcile"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.corrected").value(2));

    assertEquals(2, total(p, TaskCategory.CUTTING));
    assertEquals(1, completed(p, TaskCategory.CUTTING));
    assertEquals(1, total(p, TaskCategory.STRIP_CURTAIN));

    mvc.perform(get("/api/projects/" + p + "/counters/drift"))
        .andExpect(jsonPath("$.drifted").value(false));
    mvc.perform(post("/api/projects/" + p + "/counters/reconcile"))
        .andExpect(jsonPath("$.corrected").value(0));
  }

  @Test
  void unknownProjectIs404() throws Exception {
    mvc.perform(get("/api/projects/" + newProjectNo("NONE") + "/counters/drift"))
        .andExpect(status().isNotFound());
    mvc.perform(post("/api/projects/" + newProjectNo("NONE") + "/counters/reconcile"))
        .andExpect(status().isNotFound());
  }
}
