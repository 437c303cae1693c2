package com.fabtrack.api.task;

public class TaskValidationException extends RuntimeException {

  public TaskValidationException(String message) {
    super(message);
  }
}
