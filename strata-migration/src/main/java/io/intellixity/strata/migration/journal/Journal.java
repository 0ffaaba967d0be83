package io.intellixity.strata.migration.journal;

import io.intellixity.strata.migration.MigrationFiles;

import java.util.*;

/**
 * Developer-side record of locally created migrations. Only used to spot sequence-number
 * collisions between concurrently authored files; application is driven by the history ledger.
 */
public record Journal(int version, List<JournalEntry> migrations) {
  public static final int CURRENT_VERSION = 1;

  public Journal {
    migrations = migrations == null ? List.of() : List.copyOf(migrations);
  }

  public static Journal empty() {
    return new Journal(CURRENT_VERSION, List.of());
  }

  /** A new journal with {@code entry} appended; this one is unchanged. */
  public Journal withEntry(JournalEntry entry) {
    Objects.requireNonNull(entry, "entry");
    List<JournalEntry> next = new ArrayList<>(migrations);
    next.add(entry);
    return new Journal(version, next);
  }

  /**
   * Files whose sequence number is already taken by a journal entry of another name.
   * Suggestions start after the highest sequence in the journal and in {@code fileNames},
   * and each further collision takes the next one.
   */
  public List<Collision> detectCollisions(List<String> fileNames) {
    Map<Long, String> bySequence = new HashMap<>();
    Set<String> journaled = new HashSet<>();
    long next = 0;
    for (JournalEntry e : migrations) {
      journaled.add(e.name());
      Optional<MigrationFiles.ParsedName> p = MigrationFiles.parseName(e.name());
      if (p.isEmpty()) continue;
      bySequence.putIfAbsent(p.get().sequence(), e.name());
      next = Math.max(next, p.get().sequence());
    }
    for (String f : fileNames) {
      Optional<MigrationFiles.ParsedName> p = MigrationFiles.parseName(f);
      if (p.isPresent() && journaled.contains(f)) next = Math.max(next, p.get().sequence());
    }

    List<Collision> out = new ArrayList<>();
    for (String f : fileNames) {
      if (journaled.contains(f)) continue;
      Optional<MigrationFiles.ParsedName> p = MigrationFiles.parseName(f);
      if (p.isEmpty()) continue;
      String existing = bySequence.get(p.get().sequence());
      if (existing == null) continue;
      next++;
      String suggested = String.format(Locale.ROOT, "%04d_%s.%s", next, p.get().description(), p.get().extension());
      out.add(new Collision(existing, f, p.get().sequence(), suggested));
    }
    return out;
  }
}
