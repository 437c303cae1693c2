package com.fabtrack.api.it;

import com.fabtrack.api.task.TaskCategory;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SubtaskApiTest extends IntegrationTestBase {

  @Test
  void subtasksAreListedPerTaskAndCanBeClosed() throws Exception {
    String p = newProjectNo("SUB");
    long projectId = createProject(p);
    long taskId = createTask(TaskCategory.ACCESSORIES, p, "pending");

    String body = mvc.perform(post("/api/subtasks")
            .contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"title":"Fit hinges","project_id":%d,"category_task_id":%d,"category":"accessories"}
                """.formatted(projectId, taskId)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.status").value("pending"))
        .andReturn().getResponse().getContentAsString();
    int id = JsonPath.read(body, "$.id");

    mvc.perform(get("/api/subtasks/task/" + taskId).param("category", "ACCESSORIES"))
        .andExpect(jsonPath("$.length()").value(1));
    mvc.perform(get("/api/subtasks/task/" + taskId).param("category", "door"))
        .andExpect(jsonPath("$.length()").value(0));

    mvc.perform(patch("/api/subtasks/" + id + "/done"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("done"));

    mvc.perform(delete("/api/subtasks/" + id)).andExpect(status().isNoContent());
    mvc.perform(delete("/api/subtasks/" + id)).andExpect(status().isNotFound());
    mvc.perform(patch("/api/subtasks/" + id + "/done")).andExpect(status().isNotFound());
  }

  @Test
  void missingParentIdsAreRejected() throws Exception {
    mvc.perform(post("/api/subtasks")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"title\":\"orphan\"}"))
        .andExpect(status().isUnprocessableEntity());
  }
}
