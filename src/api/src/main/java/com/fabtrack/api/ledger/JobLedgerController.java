package com.fabtrack.api.ledger;

import com.fabtrack.api.infra.MessageResponse;
import com.fabtrack.api.ledger.dto.CreateJobRequest;
import com.fabtrack.api.ledger.dto.JobDto;
import com.fabtrack.api.ledger.dto.UpdateJobRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/projects")
public class JobLedgerController {

  private final JobLedgerService service;

  @GetMapping
  public ResponseEntity<List<JobDto>> list() {
    return ResponseEntity.ok(service.list());
  }

  @GetMapping("/{jobNo}")
  public ResponseEntity<JobDto> get(@PathVariable String jobNo) {
    return ResponseEntity.ok(service.get(jobNo));
  }

  @PostMapping
  public ResponseEntity<JobDto> create(@Valid @RequestBody CreateJobRequest req) {
    return ResponseEntity.status(HttpStatus.CREATED).body(service.create(req));
  }

  @PutMapping("/{jobNo}")
  public ResponseEntity<JobDto> update(@PathVariable String jobNo,
                                       @RequestBody(required = false) UpdateJobRequest req) {
    return ResponseEntity.ok(service.update(jobNo, req));
  }

  @DeleteMapping("/{jobNo}")
  public ResponseEntity<MessageResponse> delete(@PathVariable String jobNo) {
    service.delete(jobNo);
    return ResponseEntity.ok(new MessageResponse("Job " + jobNo + " deleted successfully"));
  }
}
