package com.fabtrack.api.project;

public class ProjectNotFoundException extends RuntimeException {

  public ProjectNotFoundException(String message) {
    super(message);
  }

  public static ProjectNotFoundException byNo(String projectNo) {
    return new ProjectNotFoundException("Project with number " + projectNo + " not found");
  }

  public static ProjectNotFoundException byId(long id) {
    return new ProjectNotFoundException("Project not found: id=" + id);
  }
}
