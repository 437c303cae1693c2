package com.fabtrack.api.activity;

public enum ActivityType {
  CREATE,
  UPDATE,
  DELETE,
  UPLOAD
}
