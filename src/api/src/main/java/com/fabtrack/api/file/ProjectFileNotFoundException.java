package com.fabtrack.api.file;

public class ProjectFileNotFoundException extends RuntimeException {

  public ProjectFileNotFoundException(String message) {
    super(message);
  }
}
