package com.fabtrack.api.infra;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;

@RestController
public class HealthController {

  private final String serviceName;

  public HealthController(@Value("${spring.application.name:fabtrack-api}") String serviceName) {
    this.serviceName = serviceName;
  }

  public record HealthResponse(String status, OffsetDateTime timestamp, String service) {
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return new HealthResponse("OK", OffsetDateTime.now(), serviceName);
  }
}
