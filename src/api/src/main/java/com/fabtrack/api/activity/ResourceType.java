package com.fabtrack.api.activity;

public enum ResourceType {
  PROJECT,
  FILE,
  TASK,
  JOB,
  SUBTASK,
  ORDER
}
