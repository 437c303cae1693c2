package com.fabtrack.api.completion;

public record CategoryCompletion(int completed, int total, int percentage) {

  public static final CategoryCompletion EMPTY = new CategoryCompletion(0, 0, 0);

  public static CategoryCompletion of(int completed, int total) {
    return new CategoryCompletion(completed, total, percentage(completed, total));
  }

  /** {@code round(100 * completed / total)} with halves rounded up, or 0 when there are no tasks. */
  static int percentage(int completed, int total) {
    if (total <= 0) return 0;
    return (int) ((200L * completed + total) / (2L * total));
  }
}
