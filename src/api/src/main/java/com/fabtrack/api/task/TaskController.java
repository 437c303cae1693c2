package com.fabtrack.api.task;

import com.fabtrack.api.infra.MessageResponse;
import com.fabtrack.api.task.dto.CreateTaskRequest;
import com.fabtrack.api.task.dto.TaskDto;
import com.fabtrack.api.task.dto.UpdateTaskRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/** One route family per category: {@code /api/panel-tasks}, {@code /api/strip-curtain-tasks}, ... */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/{category}-tasks")
public class TaskController {

  private final TaskService service;

  @GetMapping
  public ResponseEntity<List<TaskDto>> list(@PathVariable String category,
                                            @RequestParam(required = false) String projectNo,
                                            @RequestParam(required = false) String approveStatus) {
    return ResponseEntity.ok(service.list(resolve(category), projectNo, approveStatus));
  }

  @GetMapping("/{id}")
  public ResponseEntity<TaskDto> get(@PathVariable String category, @PathVariable long id) {
    return ResponseEntity.ok(service.get(resolve(category), id));
  }

  @PostMapping
  public ResponseEntity<TaskDto> create(@PathVariable String category,
                                        @Valid @RequestBody CreateTaskRequest req) {
    return ResponseEntity.status(HttpStatus.CREATED).body(service.create(resolve(category), req));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<TaskDto> update(@PathVariable String category,
                                        @PathVariable long id,
                                        @RequestBody(required = false) UpdateTaskRequest req) {
    return ResponseEntity.ok(service.update(resolve(category), id, req));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<MessageResponse> delete(@PathVariable String category, @PathVariable long id) {
    TaskCategory c = resolve(category);
    service.delete(c, id);
    return ResponseEntity.ok(new MessageResponse(c.titlePrefix() + " task deleted successfully"));
  }

  private static TaskCategory resolve(String slug) {
    return TaskCategory.fromSlug(slug)
        .orElseThrow(() -> new TaskNotFoundException("Unknown task category: " + slug));
  }
}
