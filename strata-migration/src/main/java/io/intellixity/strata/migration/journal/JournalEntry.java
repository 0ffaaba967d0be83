package io.intellixity.strata.migration.journal;

import java.util.Objects;

/** {@code createdAt} is kept as the ISO-8601 text it was written with. */
public record JournalEntry(String name, String description, String createdAt, String checksum) {
  public JournalEntry {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(checksum, "checksum");
  }
}
