package com.fabtrack.api.project;

import com.fabtrack.api.activity.ActivityLogService;
import com.fabtrack.api.activity.ActivityType;
import com.fabtrack.api.activity.ResourceType;
import com.fabtrack.api.completion.CategoryCompletion;
import com.fabtrack.api.completion.CompletionService;
import com.fabtrack.api.file.ProjectFileRepository;
import com.fabtrack.api.infra.tx.TransactionalExecutor;
import com.fabtrack.api.ledger.JobLedgerRepository;
import com.fabtrack.api.ledger.NewJob;
import com.fabtrack.api.project.dto.CreateProjectRequest;
import com.fabtrack.api.project.dto.ProjectDto;
import com.fabtrack.api.project.dto.UpdateProjectRequest;
import com.fabtrack.api.subtask.SubtaskRepository;
import com.fabtrack.api.task.TaskCategory;
import com.fabtrack.api.task.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectService {

  /** Status filters the status route answers; any other value yields an empty list. */
  static final Set<String> LISTABLE_STATUSES = Set.of("active", "done", "approved", "draft");

  private final ProjectRepository repo;
  private final TaskRepository tasks;
  private final ProjectFileRepository files;
  private final SubtaskRepository subtasks;
  private final JobLedgerRepository ledger;
  private final CompletionService completionService;
  private final ActivityLogService activityLog;
  private final TransactionalExecutor tx;

  public List<ProjectDto> list() {
    return repo.listAll().stream().map(this::withCompletionOrZero).toList();
  }

  public List<ProjectDto> listByStatus(String status) {
    if (status == null || !LISTABLE_STATUSES.contains(status.trim().toLowerCase())) {
      return List.of();
    }
    return repo.listByStatus(status.trim()).stream().map(this::withCompletionOrZero).toList();
  }

  public ProjectDto get(String projectNo) {
    ProjectDto p = repo.findByProjectNo(projectNo).orElseThrow(() -> ProjectNotFoundException.byNo(projectNo));
    return p.withCompletion(completionService.calculateCompletion(p.projectNo()));
  }

  public Map<String, CategoryCompletion> completion(String projectNo) {
    if (!repo.existsByProjectNo(projectNo)) {
      throw ProjectNotFoundException.byNo(projectNo);
    }
    return completionService.calculateCompletion(projectNo);
  }

  public ProjectDto create(CreateProjectRequest req) {
    if (req.projectNo() == null || req.projectNo().isBlank()) {
      throw new ProjectValidationException("Project Number is required", 422);
    }
    if (req.customer() == null || req.customer().isBlank()) {
      throw new ProjectValidationException("Customer is required", 422);
    }
    String projectNo = sanitizeProjectNo(req.projectNo());
    Map<TaskCategory, Integer> initialCompleted = initialCompleted(req.completed());

    return tx.execute(() -> {
      if (repo.existsByProjectNo(projectNo)) {
        throw new ProjectValidationException("Project Number '" + projectNo + "' already exists.", 409);
      }
      long id = repo.insert(projectNo, req, initialCompleted);

      if (!ledger.exists(projectNo)) {
        ledger.insert(new NewJob(
            req.drawingDate() == null ? LocalDate.now() : req.drawingDate(),
            projectNo,
            req.customer().trim(),
            orZero(req.sales()),
            orZero(req.sell()),
            orZero(req.cost()),
            orZero(req.margin()),
            "Pending",
            req.remark(),
            null
        ));
      }

      activityLog.record(ActivityType.CREATE, ResourceType.PROJECT, id,
          "Created project " + projectNo + " for " + req.customer().trim(),
          Map.of("projectNo", projectNo, "customer", req.customer().trim()));
      log.info("Project created: id={} projectNo={}", id, projectNo);
      return repo.findById(id).orElseThrow(() -> ProjectNotFoundException.byId(id));
    });
  }

  /**
   * Partial update. Renaming the project number carries its tasks and files along, so the stored
   * counters keep describing the same task rows.
   */
  public ProjectDto update(long id, UpdateProjectRequest req) {
    Map<String, Object> changes = req == null ? new LinkedHashMap<>() : new LinkedHashMap<>(req.changedColumns());
    if (changes.isEmpty()) {
      throw new ProjectValidationException("No valid fields provided for update.", 422);
    }
    if (changes.containsKey("project_no")) {
      String raw = (String) changes.get("project_no");
      if (raw.isBlank()) throw new ProjectValidationException("Project Number cannot be empty", 422);
      changes.put("project_no", sanitizeProjectNo(raw));
    }
    if (changes.containsKey("customer") && ((String) changes.get("customer")).isBlank()) {
      throw new ProjectValidationException("Customer cannot be empty", 422);
    }

    return tx.execute(() -> {
      ProjectDto before = repo.findById(id).orElseThrow(() -> ProjectNotFoundException.byId(id));
      String newNo = (String) changes.get("project_no");
      boolean renamed = newNo != null && !newNo.equals(before.projectNo());
      if (renamed && repo.existsByProjectNo(newNo)) {
        throw new ProjectValidationException("Project Number '" + newNo + "' already exists.", 409);
      }

      repo.update(id, changes);
      if (renamed) {
        for (TaskCategory c : TaskCategory.values()) {
          tasks.reassignProject(c, before.projectNo(), newNo);
        }
        files.reassignProject(before.projectNo(), newNo);
        log.info("Project renamed: id={} {} -> {}", id, before.projectNo(), newNo);
      }

      ProjectDto after = repo.findById(id).orElseThrow(() -> ProjectNotFoundException.byId(id));
      activityLog.record(ActivityType.UPDATE, ResourceType.PROJECT, id,
          "Project " + after.projectNo() + " updated.",
          Map.of("fieldsUpdated", List.copyOf(changes.keySet())));
      return after;
    });
  }

  public ProjectDto updateStatus(long id, String status) {
    if (status == null || status.isBlank()) {
      throw new ProjectValidationException("Status is required.", 422);
    }
    return tx.execute(() -> {
      ProjectDto before = repo.findById(id).orElseThrow(() -> ProjectNotFoundException.byId(id));
      repo.updateStatus(id, status.trim());
      activityLog.record(ActivityType.UPDATE, ResourceType.PROJECT, id,
          "Project " + before.projectNo() + " status updated to " + status.trim() + ".",
          Map.of("oldStatus", String.valueOf(before.status()), "newStatus", status.trim()));
      return repo.findById(id).orElseThrow(() -> ProjectNotFoundException.byId(id));
    });
  }

  /** Removes the project together with its files, tasks and sub-tasks. */
  public void delete(long id) {
    tx.run(() -> {
      ProjectDto p = repo.findById(id).orElseThrow(() -> ProjectNotFoundException.byId(id));
      int fileCount = files.deleteByProject(p.projectNo());
      int taskCount = 0;
      for (TaskCategory c : TaskCategory.values()) {
        taskCount += tasks.deleteByProject(c, p.projectNo());
      }
      subtasks.deleteByProject(id);
      repo.delete(id);

      activityLog.record(ActivityType.DELETE, ResourceType.PROJECT, id,
          "Project " + p.projectNo() + " for " + p.customer() + " and all associated files deleted.",
          Map.of("projectNo", p.projectNo(), "files", fileCount, "tasks", taskCount));
      log.info("Project deleted: id={} projectNo={} files={} tasks={}", id, p.projectNo(), fileCount, taskCount);
    });
  }

  public static String sanitizeProjectNo(String projectNo) {
    return projectNo.trim().replace('/', '_');
  }

  private ProjectDto withCompletionOrZero(ProjectDto p) {
    try {
      return p.withCompletion(completionService.calculateCompletion(p.projectNo()));
    } catch (RuntimeException ex) {
      log.error("Completion failed for project {}; reporting zeros", p.projectNo(), ex);
      return p.withCompletion(CompletionService.zeroFilled());
    }
  }

  private static Map<TaskCategory, Integer> initialCompleted(Map<String, Integer> completed) {
    Map<TaskCategory, Integer> out = new EnumMap<>(TaskCategory.class);
    if (completed == null) return out;
    completed.forEach((key, value) -> {
      TaskCategory c = TaskCategory.fromKey(key)
          .orElseThrow(() -> new ProjectValidationException("Unknown task category: " + key, 422));
      if (value != null) {
        if (value < 0) throw new ProjectValidationException("Completed count cannot be negative: " + key, 422);
        out.put(c, value);
      }
    });
    return out;
  }

  private static BigDecimal orZero(BigDecimal v) {
    return v == null ? BigDecimal.ZERO : v;
  }
}
