package com.fabtrack.api.task;

import com.fabtrack.api.activity.ActivityLogService;
import com.fabtrack.api.activity.ActivityType;
import com.fabtrack.api.activity.ResourceType;
import com.fabtrack.api.counter.CounterTransitions;
import com.fabtrack.api.counter.CounterUpdater;
import com.fabtrack.api.counter.TaskState;
import com.fabtrack.api.infra.tx.TransactionalExecutor;
import com.fabtrack.api.task.dto.CreateTaskRequest;
import com.fabtrack.api.task.dto.TaskDto;
import com.fabtrack.api.task.dto.UpdateTaskRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Task CRUD for every category. Each mutation and the counter adjustments it implies run in one
 * transaction; the task row is locked before it is changed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskService {

  private final TaskRepository repo;
  private final CounterTransitions transitions;
  private final CounterUpdater counterUpdater;
  private final ActivityLogService activityLog;
  private final TransactionalExecutor tx;

  public List<TaskDto> list(TaskCategory category, String projectNo, String approveStatus) {
    return repo.list(category, projectNo, approveStatus);
  }

  public TaskDto get(TaskCategory category, long id) {
    return repo.findById(category, id).orElseThrow(TaskNotFoundException::new);
  }

  public TaskDto create(TaskCategory category, CreateTaskRequest req) {
    if (req.title() == null || req.title().isBlank()) {
      throw new TaskValidationException("Title is required");
    }
    if (req.projectNo() == null || req.projectNo().isBlank()) {
      throw new TaskValidationException("Project No is required");
    }
    NewTask task = new NewTask(
        req.title().trim(),
        emptyToNull(req.description()),
        req.priority(),
        req.statusOrDefault(),
        req.projectNo().trim(),
        TaskDates.parseOrNull(req.dueDate()),
        req.approveStatus()
    );
    return create(category, task);
  }

  public TaskDto create(TaskCategory category, NewTask task) {
    return tx.execute(() -> {
      long id = repo.insert(category, task);
      TaskState created = new TaskState(task.projectNo(), task.status());
      counterUpdater.apply(transitions.onCreate(category, created));

      activityLog.record(ActivityType.CREATE, ResourceType.TASK, id,
          "Created " + category.key() + " task: " + task.title(),
          details(category, task.projectNo(), task.status()));
      log.info("Task created: category={} id={} projectNo={} status={}",
          category.key(), id, task.projectNo(), task.status());
      return repo.findById(category, id).orElseThrow(TaskNotFoundException::new);
    });
  }

  public TaskDto update(TaskCategory category, long id, UpdateTaskRequest req) {
    Map<String, Object> changes = req == null ? Map.of() : req.changedColumns();
    if (changes.isEmpty()) {
      throw new TaskValidationException("No fields to update");
    }
    if (changes.containsKey("project_no") && ((String) changes.get("project_no")).isBlank()) {
      throw new TaskValidationException("Project No cannot be empty");
    }
    if (changes.containsKey("title") && ((String) changes.get("title")).isBlank()) {
      throw new TaskValidationException("Title cannot be empty");
    }

    return tx.execute(() -> {
      TaskDto before = repo.lockById(category, id).orElseThrow(TaskNotFoundException::new);
      repo.update(category, id, changes);

      TaskState was = new TaskState(before.projectNo(), before.status());
      TaskState now = new TaskState(
          (String) changes.getOrDefault("project_no", before.projectNo()),
          (String) changes.getOrDefault("status", before.status()));
      counterUpdater.apply(transitions.onUpdate(category, was, now));

      activityLog.record(ActivityType.UPDATE, ResourceType.TASK, id,
          "Updated " + category.key() + " task: " + before.title(),
          details(category, now.projectNo(), now.status()));
      log.info("Task updated: category={} id={} fields={}", category.key(), id, changes.keySet());
      return repo.findById(category, id).orElseThrow(TaskNotFoundException::new);
    });
  }

  public void delete(TaskCategory category, long id) {
    if (deleteIfExists(category, id).isEmpty()) {
      throw new TaskNotFoundException();
    }
  }

  /** Deletes the task when present and returns what was deleted. */
  public Optional<TaskDto> deleteIfExists(TaskCategory category, long id) {
    return tx.execute(() -> {
      Optional<TaskDto> found = repo.lockById(category, id);
      if (found.isEmpty()) return Optional.<TaskDto>empty();
      TaskDto task = found.get();
      repo.delete(category, id);
      counterUpdater.apply(transitions.onDelete(category, new TaskState(task.projectNo(), task.status())));

      activityLog.record(ActivityType.DELETE, ResourceType.TASK, id,
          "Deleted " + category.key() + " task: " + task.title(),
          details(category, task.projectNo(), task.status()));
      log.info("Task deleted: category={} id={} projectNo={}", category.key(), id, task.projectNo());
      return found;
    });
  }

  private static Map<String, Object> details(TaskCategory category, String projectNo, String status) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("category", category.key());
    m.put("projectNo", projectNo);
    m.put("status", status);
    return m;
  }

  private static String emptyToNull(String s) {
    return s == null || s.isEmpty() ? null : s;
  }
}
