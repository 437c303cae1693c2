package com.fabtrack.api.task;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a task status counts as completed. Shared by the counter hooks and the completion
 * aggregator so both read the same vocabulary.
 *
 * <p>Matching is case-insensitive equality; surrounding whitespace in a status is significant.
 */
@Component
public class CompletionStatusPolicy {

  private final List<String> completedValues;

  public CompletionStatusPolicy(CompletionStatusProperties properties) {
    this.completedValues = properties.completedValues().stream()
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .map(CompletionStatusPolicy::normalize)
        .distinct()
        .toList();
  }

  public boolean isCompleted(String status) {
    if (status == null) return false;
    return completedValues.contains(normalize(status));
  }

  /** Lower-cased values, for {@code lower(status) in (...)} comparisons. */
  public List<String> completedValues() {
    return completedValues;
  }

  private static String normalize(String s) {
    return s.toLowerCase(Locale.ROOT);
  }
}
