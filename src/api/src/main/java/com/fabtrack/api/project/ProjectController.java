package com.fabtrack.api.project;

import com.fabtrack.api.completion.CategoryCompletion;
import com.fabtrack.api.project.dto.CreateProjectRequest;
import com.fabtrack.api.project.dto.ProjectDto;
import com.fabtrack.api.project.dto.UpdateProjectRequest;
import com.fabtrack.api.project.dto.UpdateProjectStatusRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/projects")
public class ProjectController {

  private final ProjectService service;

  @GetMapping
  public ResponseEntity<List<ProjectDto>> list() {
    return ResponseEntity.ok(service.list());
  }

  @GetMapping("/status/{status}")
  public ResponseEntity<List<ProjectDto>> listByStatus(@PathVariable String status) {
    return ResponseEntity.ok(service.listByStatus(status));
  }

  @GetMapping("/completion/{projectNo}")
  public ResponseEntity<Map<String, CategoryCompletion>> completion(@PathVariable String projectNo) {
    return ResponseEntity.ok(service.completion(projectNo));
  }

  @GetMapping("/{projectNo}")
  public ResponseEntity<ProjectDto> get(@PathVariable String projectNo) {
    return ResponseEntity.ok(service.get(projectNo));
  }

  @PostMapping
  public ResponseEntity<ProjectDto> create(@Valid @RequestBody CreateProjectRequest req) {
    return ResponseEntity.status(HttpStatus.CREATED).body(service.create(req));
  }

  @PutMapping("/{id}")
  public ResponseEntity<ProjectDto> update(@PathVariable long id,
                                           @RequestBody(required = false) UpdateProjectRequest req) {
    return ResponseEntity.ok(service.update(id, req));
  }

  @PatchMapping("/{id}/status")
  public ResponseEntity<ProjectDto> updateStatus(@PathVariable long id,
                                                 @Valid @RequestBody UpdateProjectStatusRequest req) {
    return ResponseEntity.ok(service.updateStatus(id, req.status()));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable long id) {
    service.delete(id);
    return ResponseEntity.noContent().build();
  }
}
