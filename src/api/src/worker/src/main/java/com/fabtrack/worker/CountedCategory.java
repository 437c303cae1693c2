package com.fabtrack.worker;

/**
 * Task categories whose rows are counted on {@code projects}. Table and column names are only ever
 * taken from these constants.
 */
public enum CountedCategory {
  PANEL("panel"),
  DOOR("door"),
  CUTTING("cutting"),
  ACCESSORIES("accessories"),
  STRIP_CURTAIN("strip_curtain"),
  SYSTEM("system"),
  TRANSPORTATION("transportation"),
  QUOTATION("quotation");

  private final String key;
  private final String table;
  private final String totalColumn;
  private final String completedColumn;

  CountedCategory(String key) {
    this.key = key;
    this.table = key + "_tasks";
    this.totalColumn = "total_" + key;
    this.completedColumn = "completed_" + key;
  }

  public String key() {
    return key;
  }

  public String table() {
    return table;
  }

  public String totalColumn() {
    return totalColumn;
  }

  public String completedColumn() {
    return completedColumn;
  }
}
