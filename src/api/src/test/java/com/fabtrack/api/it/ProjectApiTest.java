package com.fabtrack.api.it;

import com.fabtrack.api.task.TaskCategory;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ProjectApiTest extends IntegrationTestBase {

  @Test
  void createSanitisesProjectNoAndOpensLedgerRow() throws Exception {
    String raw = newProjectNo("JOB") + "/A";
    String safe = raw.replace('/', '_');

    mvc.perform(post("/api/projects")
            .contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"projectNo":"%s","customer":"Polar Foods","sales":1200.50,"cost":800,
                 "completed":{"door":2}}
                """.formatted(raw)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.projectNo").value(safe))
        .andExpect(jsonPath("$.status").value("active"))
        .andExpect(jsonPath("$.counters.door.completed").value(2))
        .andExpect(jsonPath("$.counters.door.total").value(0));

    mvc.perform(get("/api/admin/projects/" + safe))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.customerName").value("Polar Foods"))
        .andExpect(jsonPath("$.salesAmount").value(1200.50))
        .andExpect(jsonPath("$.approvalStatus").value("Pending"));
  }

  @Test
  void duplicateProjectNoIsConflict() throws Exception {
    String p = newProjectNo("DUP");
    createProject(p);

    mvc.perform(post("/api/projects")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"projectNo\":\"" + p + "\",\"customer\":\"Other\"}"))
        .andExpect(status().isConflict());
  }

  @Test
  void getIncludesCompletionAndUnknownIs404() throws Exception {
    String p = newProjectNo("GET");
    createProject(p);
    createTask(TaskCategory.PANEL, p, "completed");

    mvc.perform(get("/api/projects/" + p))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.completion.panel.percentage").value(100))
        .andExpect(jsonPath("$.counters.panel.total").value(1));

    mvc.perform(get("/api/projects/completion/" + newProjectNo("NONE")))
        .andExpect(status().isNotFound());
  }

  @Test
  void listByStatusIsCaseInsensitiveAndUnknownStatusIsEmpty() throws Exception {
    String p = newProjectNo("ST");
    createProject(p, "Approved");

    mvc.perform(get("/api/projects/status/approved"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[?(@.projectNo == '" + p + "')]").exists());

    mvc.perform(get("/api/projects/status/archived"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(0));
  }

  @Test
  void updateAndStatusChange() throws Exception {
    String p = newProjectNo("UP");
    long id = createProject(p);

    mvc.perform(put("/api/projects/" + id)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"remark\":\"rush\",\"salesman\":\"Lee\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.remark").value("rush"))
        .andExpect(jsonPath("$.salesman").value("Lee"));

    mvc.perform(put("/api/projects/" + id).contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isUnprocessableEntity());

    mvc.perform(patch("/api/projects/" + id + "/status")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"status\":\"done\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("done"));

    mvc.perform(patch("/api/projects/999999999/status")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"status\":\"done\"}"))
        .andExpect(status().isNotFound());
  }

  @Test
  void renamingProjectCarriesTasksAlong() throws Exception {
    String p = newProjectNo("OLD");
    String renamed = newProjectNo("NEW");
    long id = createProject(p);
    createTask(TaskCategory.CUTTING, p, "done");

    mvc.perform(put("/api/projects/" + id)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"projectNo\":\"" + renamed + "\"}"))
        .andExpect(status().isOk());

    mvc.perform(get("/api/projects/" + renamed + "/counters/drift"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.drifted").value(false));
    assertEquals(1, total(renamed, TaskCategory.CUTTING));
  }

  @Test
  void deleteCascadesToTasksAndFiles() throws Exception {
    String p = newProjectNo("DEL");
    long id = createProject(p);
    createTask(TaskCategory.PANEL, p, "pending");
    createTask(TaskCategory.DOOR, p, "done");
    jdbc.update("insert into project_files(project_no, file_name, file_size, file_data) values (?,?,?,?)",
        p, "a.pdf", 3, new byte[]{1, 2, 3});

    mvc.perform(delete("/api/projects/" + id)).andExpect(status().isNoContent());

    assertEquals(0, jdbc.queryForObject("select count(*) from panel_tasks where project_no = ?", Integer.class, p));
    assertEquals(0, jdbc.queryForObject("select count(*) from door_tasks where project_no = ?", Integer.class, p));
    assertEquals(0, jdbc.queryForObject("select count(*) from project_files where project_no = ?", Integer.class, p));
    assertEquals(0, jdbc.queryForObject("select count(*) from projects where id = ?", Integer.class, id));

    mvc.perform(delete("/api/projects/" + id)).andExpect(status().isNotFound());
  }

  @Test
  void mutationsAreRecordedInActivityLog() throws Exception {
    String p = newProjectNo("ACT");
    long id = createProject(p);

    mvc.perform(get("/api/activity-logs")
            .param("resourceType", "PROJECT")
            .param("resourceId", String.valueOf(id)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.data[0].activityType").value("CREATE"));
  }
}
