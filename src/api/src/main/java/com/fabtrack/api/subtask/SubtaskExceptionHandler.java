package com.fabtrack.api.subtask;

import com.fabtrack.api.infra.ErrorResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice
public class SubtaskExceptionHandler {

  @ExceptionHandler(SubtaskNotFoundException.class)
  public ResponseEntity<ErrorResponse> notFound(SubtaskNotFoundException ex) {
    return ResponseEntity.status(404).body(ErrorResponse.of("NOT_FOUND", ex.getMessage()));
  }
}
