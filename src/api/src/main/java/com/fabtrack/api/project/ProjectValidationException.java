package com.fabtrack.api.project;

public class ProjectValidationException extends RuntimeException {

  private final int httpStatus;

  public ProjectValidationException(String message, int httpStatus) {
    super(message);
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
