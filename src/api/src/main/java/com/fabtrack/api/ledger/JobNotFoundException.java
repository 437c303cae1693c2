package com.fabtrack.api.ledger;

public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String jobNo) {
    super("Job with Job No " + jobNo + " not found");
  }
}
