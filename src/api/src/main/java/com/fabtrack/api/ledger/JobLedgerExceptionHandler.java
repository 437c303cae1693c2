package com.fabtrack.api.ledger;

import com.fabtrack.api.infra.ErrorResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice
public class JobLedgerExceptionHandler {

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ErrorResponse> notFound(JobNotFoundException ex) {
    return ResponseEntity.status(404).body(ErrorResponse.of("NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(JobValidationException.class)
  public ResponseEntity<ErrorResponse> validation(JobValidationException ex) {
    int status = ex.httpStatus();
    String code = status == 409 ? "CONFLICT" : "UNPROCESSABLE_ENTITY";
    return ResponseEntity.status(status).body(ErrorResponse.of(code, ex.getMessage()));
  }
}
