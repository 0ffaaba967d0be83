package io.intellixity.strata.migration;

import java.util.Objects;

/** One migration on durable storage; {@code name} is the exact filename and the identity key. */
public record MigrationFile(String name, String sql, long sequence) {
  public MigrationFile {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(sql, "sql");
    if (sequence < 0) throw new IllegalArgumentException("sequence must be >= 0: " + sequence);
  }

  /** Sequence taken from {@code name}; fails for names outside the {@code NNNN_description.ext} convention. */
  public static MigrationFile of(String name, String sql) {
    MigrationFiles.ParsedName parsed = MigrationFiles.parseName(name)
        .orElseThrow(() -> new IllegalArgumentException("Not a migration file name: " + name));
    return new MigrationFile(name, sql, parsed.sequence());
  }
}
