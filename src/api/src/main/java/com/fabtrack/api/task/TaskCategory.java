package com.fabtrack.api.task;

import com.fabtrack.api.counter.CounterKind;

import java.util.Arrays;
import java.util.Optional;

/**
 * Task partitions of a project. Each category owns one task table and one pair of counter columns
 * on {@code projects}; these are the only identifiers ever placed into SQL text.
 */
public enum TaskCategory {

  PANEL("panel", "panel", "Panel"),
  DOOR("door", "door", "Door"),
  CUTTING("cutting", "cutting", "Cutting"),
  ACCESSORIES("accessories", "accessories", "Accessories"),
  STRIP_CURTAIN("strip_curtain", "strip-curtain", "Strip Curtain"),
  SYSTEM("system", "system", "System"),
  TRANSPORTATION("transportation", "transportation", "Transport"),
  QUOTATION("quotation", "quotation", "Quotation");

  private final String key;
  private final String slug;
  private final String titlePrefix;

  TaskCategory(String key, String slug, String titlePrefix) {
    this.key = key;
    this.slug = slug;
    this.titlePrefix = titlePrefix;
  }

  /** Name used in JSON payloads and in the {@code project_files.category} column. */
  public String key() {
    return key;
  }

  /** Path segment of the category's task routes, {@code /api/<slug>-tasks}. */
  public String slug() {
    return slug;
  }

  public String titlePrefix() {
    return titlePrefix;
  }

  public String table() {
    return key + "_tasks";
  }

  public String totalColumn() {
    return "total_" + key;
  }

  public String completedColumn() {
    return "completed_" + key;
  }

  public String column(CounterKind kind) {
    return kind == CounterKind.TOTAL ? totalColumn() : completedColumn();
  }

  public static Optional<TaskCategory> fromSlug(String slug) {
    if (slug == null) return Optional.empty();
    return Arrays.stream(values()).filter(c -> c.slug.equalsIgnoreCase(slug.trim())).findFirst();
  }

  public static Optional<TaskCategory> fromKey(String key) {
    if (key == null) return Optional.empty();
    String k = key.trim();
    return Arrays.stream(values())
        .filter(c -> c.key.equalsIgnoreCase(k) || c.slug.equalsIgnoreCase(k))
        .findFirst();
  }
}
