package com.fabtrack.api.project;

import com.fabtrack.api.infra.ErrorResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice
public class ProjectExceptionHandler {

  @ExceptionHandler(ProjectNotFoundException.class)
  public ResponseEntity<ErrorResponse> notFound(ProjectNotFoundException ex) {
    return ResponseEntity.status(404).body(ErrorResponse.of("NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(ProjectValidationException.class)
  public ResponseEntity<ErrorResponse> validation(ProjectValidationException ex) {
    int status = ex.httpStatus();
    String code = status == 409 ? "CONFLICT" : "UNPROCESSABLE_ENTITY";
    return ResponseEntity.status(status).body(ErrorResponse.of(code, ex.getMessage()));
  }
}
