package com.fabtrack.api.task;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

public final class TaskDates {

  private TaskDates() {
  }

  /**
   * Parses an ISO date, also accepting a date-time whose first ten characters are the date. Blank
   * input means no date.
   */
  public static LocalDate parseOrNull(String value) {
    if (value == null || value.isBlank()) return null;
    String v = value.trim();
    try {
      return LocalDate.parse(v.length() > 10 ? v.substring(0, 10) : v);
    } catch (DateTimeParseException ex) {
      throw new TaskValidationException("Invalid due date: " + value);
    }
  }
}
