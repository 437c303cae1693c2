package com.fabtrack.api.it;

import com.fabtrack.api.task.TaskCategory;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class ProjectFileFlowTest extends IntegrationTestBase {

  private static MockMultipartFile file(String name, String content) {
    return new MockMultipartFile("files", name, "application/pdf", content.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void categoryUploadCreatesLinkedTasksAndCountsThem() throws Exception {
    String p = newProjectNo("UPL");
    createProject(p, "Approved");

    mvc.perform(multipart("/api/projects/upload")
            .file(file("door-a.pdf", "aaa"))
            .file(file("door-b.pdf", "bbb"))
            .param("projectNo", p)
            .param("category", "door"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(2))
        .andExpect(jsonPath("$.tasksCreated").value(2))
        .andExpect(jsonPath("$.lastTaskId").isNumber());

    assertEquals(2, total(p, TaskCategory.DOOR));
    assertEquals(0, completed(p, TaskCategory.DOOR));

    mvc.perform(get("/api/door-tasks").param("projectNo", p))
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[0].approveStatus").value("Approved"))
        .andExpect(jsonPath("$[0].priority").value("empty"))
        .andExpect(jsonPath("$[0].dueDate").value("2025-06-30"));

    String files = mvc.perform(get("/api/projects/" + p + "/files").param("category", "door"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andReturn().getResponse().getContentAsString();
    List<Integer> taskNos = JsonPath.read(files, "$[*].taskNo");
    taskNos.forEach(n -> assertNotNull(n));
  }

  @Test
  void deletingUploadedFileDeletesItsTaskThroughLifecycle() throws Exception {
    String p = newProjectNo("FDL");
    createProject(p);

    mvc.perform(multipart("/api/projects/upload")
            .file(file("panel.dwg", "xyz"))
            .param("projectNo", p)
            .param("category", "panel"))
        .andExpect(status().isOk());

    String files = mvc.perform(get("/api/projects/files/" + p))
        .andReturn().getResponse().getContentAsString();
    int fileId = JsonPath.read(files, "$[0].id");
    int taskNo = JsonPath.read(files, "$[0].taskNo");

    mvc.perform(patch("/api/panel-tasks/" + taskNo)
            .contentType("application/json")
            .content("{\"status\":\"completed\"}"))
        .andExpect(status().isOk());
    assertEquals(1, completed(p, TaskCategory.PANEL));

    mvc.perform(delete("/api/projects/file/" + fileId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.taskDeleted").value(true))
        .andExpect(jsonPath("$.taskNo").value(taskNo));

    assertEquals(0, total(p, TaskCategory.PANEL));
    assertEquals(0, completed(p, TaskCategory.PANEL));
    mvc.perform(get("/api/panel-tasks/" + taskNo)).andExpect(status().isNotFound());
    mvc.perform(delete("/api/projects/file/" + fileId)).andExpect(status().isNotFound());
  }

  @Test
  void uncategorisedUploadStoresFileOnlyAndBlobIsServed() throws Exception {
    String p = newProjectNo("BLOB");
    createProject(p);

    mvc.perform(multipart("/api/projects/upload")
            .file(new MockMultipartFile("files", "note.txt", "text/plain", "hello".getBytes(StandardCharsets.UTF_8)))
            .param("projectNo", p))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.tasksCreated").value(0));

    String files = mvc.perform(get("/api/projects/" + p + "/files").param("category", "all"))
        .andReturn().getResponse().getContentAsString();
    int fileId = JsonPath.read(files, "$[0].id");

    mvc.perform(get("/api/projects/file/blob/" + fileId))
        .andExpect(status().isOk())
        .andExpect(header().string("Content-Type", startsWith("text/plain")))
        .andExpect(header().string("Content-Disposition", startsWith("inline")))
        .andExpect(content().string("hello"));
  }

  @Test
  void uploadToUnknownProjectIs404AndEmptyUploadIs422() throws Exception {
    mvc.perform(multipart("/api/projects/upload")
            .file(file("x.pdf", "x"))
            .param("projectNo", newProjectNo("MISSING")))
        .andExpect(status().isNotFound());

    String p = newProjectNo("EMPTY");
    createProject(p);
    mvc.perform(multipart("/api/projects/upload")
            .file(new MockMultipartFile("files", "empty.pdf", "application/pdf", new byte[0]))
            .param("projectNo", p)
            .param("category", "panel"))
        .andExpect(status().isUnprocessableEntity());
    assertEquals(0, total(p, TaskCategory.PANEL));
  }
}
