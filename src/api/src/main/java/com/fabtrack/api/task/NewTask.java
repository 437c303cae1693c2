package com.fabtrack.api.task;

import java.time.LocalDate;

/** Validated values for a task insert. */
public record NewTask(
    String title,
    String description,
    String priority,
    String status,
    String projectNo,
    LocalDate dueDate,
    String approveStatus
) {
}
