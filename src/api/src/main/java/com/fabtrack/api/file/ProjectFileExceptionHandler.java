package com.fabtrack.api.file;

import com.fabtrack.api.infra.ErrorResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice
public class ProjectFileExceptionHandler {

  @ExceptionHandler(ProjectFileNotFoundException.class)
  public ResponseEntity<ErrorResponse> notFound(ProjectFileNotFoundException ex) {
    return ResponseEntity.status(404).body(ErrorResponse.of("NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(FileUploadException.class)
  public ResponseEntity<ErrorResponse> upload(FileUploadException ex) {
    return ResponseEntity.status(422).body(ErrorResponse.of("UNPROCESSABLE_ENTITY", ex.getMessage()));
  }
}
