package io.intellixity.strata.migration;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link MigrationRunner#apply}. {@code statements} lists the migration body followed by the
 * history insert, exactly as issued (or as would be issued on a dry run).
 */
public record ApplyResult(String name, String sql, String checksum, boolean dryRun, List<String> statements) {
  public ApplyResult {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(checksum, "checksum");
    statements = List.copyOf(statements);
  }
}
