package com.fabtrack.api.counter;

import com.fabtrack.api.counter.dto.CounterDriftReport;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/projects/{projectNo}/counters")
public class CounterController {

  private final CounterReconciliationService service;

  @GetMapping("/drift")
  public ResponseEntity<CounterDriftReport> drift(@PathVariable String projectNo) {
    return ResponseEntity.ok(service.drift(projectNo));
  }

  @PostMapping("/reconcile")
  public ResponseEntity<CounterDriftReport> reconcile(@PathVariable String projectNo) {
    return ResponseEntity.ok(service.reconcile(projectNo));
  }
}
