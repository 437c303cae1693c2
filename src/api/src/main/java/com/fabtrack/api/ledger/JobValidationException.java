package com.fabtrack.api.ledger;

public class JobValidationException extends RuntimeException {

  private final int httpStatus;

  public JobValidationException(String message, int httpStatus) {
    super(message);
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
