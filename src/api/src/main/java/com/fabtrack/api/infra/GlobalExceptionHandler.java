package com.fabtrack.api.infra;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@Slf4j
@Order(Ordered.LOWEST_PRECEDENCE)
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> illegalArg(IllegalArgumentException ex) {
    return ResponseEntity.badRequest().body(ErrorResponse.of("BAD_REQUEST", "Request is not valid.", ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> badJson(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(422).body(ErrorResponse.of("BAD_JSON", "Request body is not valid JSON."));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> validation(MethodArgumentNotValidException ex) {
    String debug = ex.getBindingResult().getFieldErrors().stream()
        .map(fe -> fe.getField() + ":" + fe.getDefaultMessage())
        .reduce((a, b) -> a + "; " + b)
        .orElse(null);
    return ResponseEntity.status(422).body(ErrorResponse.of("VALIDATION_ERROR", "Request validation failed.", debug));
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ErrorResponse> validation2(ConstraintViolationException ex) {
    return ResponseEntity.status(422).body(ErrorResponse.of("VALIDATION_ERROR", "Request validation failed.", ex.getMessage()));
  }

  @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
  public ResponseEntity<ErrorResponse> badParam(Exception ex) {
    return ResponseEntity.badRequest().body(ErrorResponse.of("BAD_REQUEST", "Request is not valid.", ex.getMessage()));
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorResponse> tooLarge(MaxUploadSizeExceededException ex) {
    return ResponseEntity.status(413).body(ErrorResponse.of("PAYLOAD_TOO_LARGE", "Upload exceeds the size limit."));
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ErrorResponse> notFound(NoResourceFoundException ex) {
    return ResponseEntity.status(404).body(ErrorResponse.of("NOT_FOUND", "Resource does not exist."));
  }

  @ExceptionHandler(DuplicateKeyException.class)
  public ResponseEntity<ErrorResponse> duplicate(DuplicateKeyException ex) {
    return ResponseEntity.status(409).body(ErrorResponse.of("CONFLICT", "Resource already exists."));
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ErrorResponse> database(DataAccessException ex) {
    log.error("Database error", ex);
    return ResponseEntity.status(500).body(ErrorResponse.of("DATABASE_ERROR", "Database operation failed.", ex.getClass().getName()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> unknown(Exception ex) {
    log.error("Unhandled error", ex);
    return ResponseEntity.status(500).body(ErrorResponse.of("SERVER_ERROR", "Internal server error.", ex.getClass().getName()));
  }
}
