package com.fabtrack.api.subtask;

public class SubtaskNotFoundException extends RuntimeException {

  public SubtaskNotFoundException() {
    super("Sub-task not found");
  }
}
