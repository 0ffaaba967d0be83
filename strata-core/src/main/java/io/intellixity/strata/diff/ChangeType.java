package io.intellixity.strata.diff;

public enum ChangeType {
  TABLE_ADDED,
  TABLE_REMOVED,
  COLUMN_ADDED,
  COLUMN_REMOVED,
  COLUMN_ALTERED,
  COLUMN_RENAMED,
  INDEX_ADDED,
  INDEX_REMOVED,
  ENUM_ADDED,
  ENUM_REMOVED,
  ENUM_ALTERED;

  /** Lower-case wire name, e.g. {@code table_added}. */
  public String wireName() {
    return name().toLowerCase(java.util.Locale.ROOT);
  }

  public boolean isDestructive() {
    return this == TABLE_REMOVED || this == COLUMN_REMOVED;
  }
}
