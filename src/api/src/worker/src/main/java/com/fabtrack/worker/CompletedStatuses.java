package com.fabtrack.worker;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * The task statuses that count as completed, read from {@code fabtrack.status.completed-values}.
 * Matching is case-insensitive equality, the same rule the api applies.
 */
public final class CompletedStatuses {

  public static final String DEFAULT = "completed";

  private final List<String> values;

  private CompletedStatuses(List<String> values) {
    this.values = values;
  }

  /** Parses a comma-separated list; a blank list falls back to {@link #DEFAULT}. */
  public static CompletedStatuses parse(String commaSeparated) {
    List<String> values = commaSeparated == null ? List.of() : Arrays.stream(commaSeparated.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .map(s -> s.toLowerCase(Locale.ROOT))
        .distinct()
        .toList();
    return new CompletedStatuses(values.isEmpty() ? List.of(DEFAULT) : values);
  }

  /** Lower-cased values, for {@code lower(status) in (...)} comparisons. */
  public List<String> values() {
    return values;
  }
}
