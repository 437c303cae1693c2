package com.fabtrack.api.file;

import com.fabtrack.api.activity.ActivityLogService;
import com.fabtrack.api.activity.ActivityType;
import com.fabtrack.api.activity.ResourceType;
import com.fabtrack.api.file.dto.FileBlob;
import com.fabtrack.api.file.dto.FileDeleteResponse;
import com.fabtrack.api.file.dto.ProjectFileDto;
import com.fabtrack.api.file.dto.UploadResponse;
import com.fabtrack.api.infra.tx.TransactionalExecutor;
import com.fabtrack.api.project.ProjectNotFoundException;
import com.fabtrack.api.project.ProjectRepository;
import com.fabtrack.api.project.dto.ProjectDto;
import com.fabtrack.api.task.NewTask;
import com.fabtrack.api.task.TaskCategory;
import com.fabtrack.api.task.TaskService;
import com.fabtrack.api.task.dto.TaskDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Project attachments. An upload into a task category also creates one task per stored file through
 * {@link TaskService}, so the project counters move exactly as for a task created by hand.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectFileService {

  private final ProjectFileRepository repo;
  private final ProjectRepository projects;
  private final TaskService taskService;
  private final ActivityLogService activityLog;
  private final TransactionalExecutor tx;

  public UploadResponse upload(String projectNo, String category, List<MultipartFile> uploaded) {
    if (uploaded == null || uploaded.isEmpty()) {
      throw new FileUploadException("No files selected for upload.");
    }
    ProjectDto project = projects.findByProjectNo(projectNo)
        .orElseThrow(() -> new ProjectNotFoundException("Project No. " + projectNo + " not found."));
    Optional<TaskCategory> taskCategory = TaskCategory.fromKey(category);
    String storedCategory = taskCategory.map(TaskCategory::key).orElse(blankToNull(category));

    return tx.execute(() -> {
      int stored = 0;
      int tasksCreated = 0;
      Long lastTaskId = null;
      List<String> names = new ArrayList<>();

      for (MultipartFile file : uploaded) {
        if (file.isEmpty()) {
          log.warn("Skipping empty upload: projectNo={} file={}", projectNo, file.getOriginalFilename());
          continue;
        }
        try {
          Long taskId = tx.savepoint(() -> storeOne(project, storedCategory, taskCategory, file));
          stored++;
          names.add(file.getOriginalFilename());
          if (taskId != null) {
            tasksCreated++;
            lastTaskId = taskId;
          }
        } catch (RuntimeException ex) {
          log.error("Failed to store upload: projectNo={} file={}", projectNo, file.getOriginalFilename(), ex);
        }
      }

      if (stored == 0) {
        throw new FileUploadException("No files were successfully processed and uploaded.");
      }

      String target = storedCategory == null ? "database" : storedCategory;
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("projectNo", projectNo);
      details.put("customer", project.customer());
      details.put("count", stored);
      details.put("category", storedCategory == null ? "uncategorized" : storedCategory);
      details.put("tasksCreated", tasksCreated);
      details.put("lastTaskId", lastTaskId);
      activityLog.record(ActivityType.UPLOAD, ResourceType.FILE, project.id(),
          stored + " file(s) uploaded to " + target + " for project " + projectNo + ": " + String.join(", ", names),
          details);

      String message = stored + " file(s) uploaded successfully to " + target + " for project " + projectNo + ".";
      String taskMessage = "";
      if (tasksCreated > 0) {
        message += " " + tasksCreated + " corresponding task(s) created and linked.";
        taskMessage = "Successfully created and linked " + tasksCreated + " tasks.";
      }
      log.info("Upload stored: projectNo={} category={} files={} tasks={}", projectNo, storedCategory, stored, tasksCreated);
      return new UploadResponse(message, storedCategory, stored, tasksCreated, taskMessage, lastTaskId);
    });
  }

  private Long storeOne(ProjectDto project, String storedCategory, Optional<TaskCategory> taskCategory,
                        MultipartFile file) {
    String name = file.getOriginalFilename() == null ? "file" : file.getOriginalFilename();
    byte[] data;
    try {
      data = file.getBytes();
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot read upload " + name, ex);
    }
    long fileId = repo.insert(project.projectNo(), name, file.getSize(), file.getContentType(), data, storedCategory);
    if (taskCategory.isEmpty()) return null;

    TaskCategory c = taskCategory.get();
    NewTask task = new NewTask(
        c.titlePrefix() + " Task: " + name,
        "File '" + name + "' uploaded for projectNo " + project.projectNo() + ".",
        "empty",
        "pending",
        project.projectNo(),
        project.requestedDelivery(),
        "approved".equalsIgnoreCase(project.status()) ? "Approved" : "Pending"
    );
    TaskDto created = taskService.create(c, task);
    repo.linkTask(fileId, created.id());
    log.debug("Linked task {} to file {}", created.id(), fileId);
    return created.id();
  }

  public List<ProjectFileDto> list(String projectNo, String category) {
    return repo.list(projectNo, category);
  }

  public FileBlob blob(long id) {
    FileBlob blob = repo.findBlob(id).orElseThrow(() -> new ProjectFileNotFoundException("File not found."));
    if (blob.data() == null || blob.data().length == 0) {
      throw new ProjectFileNotFoundException("File data is empty or missing.");
    }
    return blob;
  }

  /** Deletes the file; a task created for it is deleted through the task lifecycle. */
  public FileDeleteResponse delete(long id) {
    return tx.execute(() -> {
      ProjectFileDto file = repo.findById(id).orElseThrow(() -> new ProjectFileNotFoundException("File not found."));
      repo.delete(id);

      boolean taskDeleted = false;
      Optional<TaskCategory> c = TaskCategory.fromKey(file.category());
      if (c.isPresent() && file.taskNo() != null) {
        taskDeleted = taskService.deleteIfExists(c.get(), file.taskNo()).isPresent();
        if (!taskDeleted) {
          log.warn("Linked task already gone: fileId={} category={} taskNo={}", id, c.get().key(), file.taskNo());
        }
      }

      Map<String, Object> details = new LinkedHashMap<>();
      details.put("projectNo", file.projectNo());
      details.put("category", file.category());
      details.put("taskDeleted", taskDeleted);
      details.put("taskNo", file.taskNo());
      activityLog.record(ActivityType.DELETE, ResourceType.FILE, id,
          "Deleted file: '" + file.fileName() + "' from project " + file.projectNo(), details);

      String category = file.category() == null ? "N/A" : file.category();
      String message = "File deleted successfully. (File: " + file.fileName() + ", Category: " + category + ")";
      if (taskDeleted) {
        message += " The corresponding task (ID: " + file.taskNo() + ") was also deleted.";
      } else if (file.taskNo() != null) {
        message += " Linked task " + file.taskNo() + " could not be deleted (may have been deleted previously).";
      }
      return new FileDeleteResponse(message, id, taskDeleted, file.taskNo());
    });
  }

  private static String blankToNull(String s) {
    return s == null || s.isBlank() ? null : s.trim();
  }
}
