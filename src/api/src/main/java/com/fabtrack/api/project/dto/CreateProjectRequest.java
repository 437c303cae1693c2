package com.fabtrack.api.project.dto;

import jakarta.validation.constraints.NotBlank;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * New project. {@code sales}, {@code sell}, {@code cost} and {@code margin} seed the job-ledger row;
 * {@code completed} optionally seeds the completed counters, keyed by category key.
 */
public record CreateProjectRequest(
    @NotBlank(message = "Project Number is required") String projectNo,
    String projectName,
    @NotBlank(message = "Customer is required") String customer,
    String salesman,
    LocalDate drawingDate,
    String poPayment,
    LocalDate requestedDelivery,
    String remark,
    String status,
    BigDecimal sales,
    BigDecimal sell,
    BigDecimal cost,
    BigDecimal margin,
    Map<String, Integer> completed
) {

  public static final String DEFAULT_STATUS = "active";

  public String statusOrDefault() {
    return status == null || status.isBlank() ? DEFAULT_STATUS : status.trim();
  }
}
