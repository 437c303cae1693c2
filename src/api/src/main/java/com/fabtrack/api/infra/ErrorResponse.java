package com.fabtrack.api.infra;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponse(String code, String message, String debug) {

  /** The code again under {@code error}, for clients that read that field. */
  @JsonProperty("error")
  public String error() {
    return code;
  }

  public static ErrorResponse of(String code, String message) {
    return new ErrorResponse(code, message, null);
  }

  public static ErrorResponse of(String code, String message, String debug) {
    return new ErrorResponse(code, message, debug);
  }
}
