package com.fabtrack.api.file;

public class FileUploadException extends RuntimeException {

  public FileUploadException(String message) {
    super(message);
  }
}
