package com.fabtrack.api.project.dto;

import com.fabtrack.api.completion.CategoryCompletion;
import com.fabtrack.api.counter.StoredCounters;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * A project row. {@code counters} holds the stored per-category counter columns keyed by category
 * key; {@code completion} is the live aggregate and is only present where a caller asked for it.
 */
public record ProjectDto(
    long id,
    String projectNo,
    String projectName,
    String customer,
    String salesman,
    LocalDate drawingDate,
    String poPayment,
    LocalDate requestedDelivery,
    String remark,
    String status,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt,
    Map<String, StoredCounters> counters,
    Map<String, CategoryCompletion> completion
) {

  public ProjectDto withCompletion(Map<String, CategoryCompletion> completion) {
    return new ProjectDto(id, projectNo, projectName, customer, salesman, drawingDate, poPayment,
        requestedDelivery, remark, status, createdAt, updatedAt, counters, completion);
  }
}
