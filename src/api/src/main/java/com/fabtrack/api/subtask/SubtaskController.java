package com.fabtrack.api.subtask;

import com.fabtrack.api.subtask.dto.CreateSubtaskRequest;
import com.fabtrack.api.subtask.dto.SubtaskDto;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/subtasks")
public class SubtaskController {

  private final SubtaskService service;

  @PostMapping
  public ResponseEntity<SubtaskDto> create(@Valid @RequestBody CreateSubtaskRequest req) {
    return ResponseEntity.status(HttpStatus.CREATED).body(service.create(req));
  }

  @GetMapping
  public ResponseEntity<List<SubtaskDto>> list() {
    return ResponseEntity.ok(service.listAll());
  }

  @GetMapping("/task/{taskId}")
  public ResponseEntity<List<SubtaskDto>> listByTask(@PathVariable long taskId,
                                                     @RequestParam(required = false) String category) {
    return ResponseEntity.ok(service.listByTask(taskId, category));
  }

  @PatchMapping("/{id}/done")
  public ResponseEntity<SubtaskDto> markDone(@PathVariable long id) {
    return ResponseEntity.ok(service.markDone(id));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable long id) {
    service.delete(id);
    return ResponseEntity.noContent().build();
  }
}
