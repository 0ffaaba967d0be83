package io.intellixity.strata.migration;

import io.intellixity.strata.diff.DiffChange;
import io.intellixity.strata.diff.DiffResult;
import io.intellixity.strata.diff.SchemaDiffer;
import io.intellixity.strata.snapshot.SchemaSnapshot;
import io.intellixity.strata.snapshot.SnapshotStorage;
import io.intellixity.strata.spi.exec.QueryFn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Development-time schema sync: diff the declared schema against the last saved snapshot,
 * apply the DDL and save the new snapshot. Destructive changes are logged, not blocked.
 * A second run without schema edits issues no DDL.
 */
public final class AutoMigrator {
  private static final Logger log = LoggerFactory.getLogger(AutoMigrator.class);

  static final String INITIAL_NAME = "auto-migrate-initial";
  static final String NAME_PREFIX = "auto-migrate-";

  private final SnapshotStorage storage;
  private final MigrationRunner runner;
  private final MigrationSqlGenerator generator;
  private final SchemaDiffer differ;
  private final Clock clock;
  private final AtomicLong lastStamp = new AtomicLong();

  public AutoMigrator(SnapshotStorage storage, MigrationRunner runner, MigrationSqlGenerator generator,
                      SchemaDiffer differ, Clock clock) {
    this.storage = Objects.requireNonNull(storage, "storage");
    this.runner = Objects.requireNonNull(runner, "runner");
    this.generator = Objects.requireNonNull(generator, "generator");
    this.differ = differ == null ? new SchemaDiffer() : differ;
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  public AutoMigrator(SnapshotStorage storage, MigrationRunner runner, MigrationSqlGenerator generator) {
    this(storage, runner, generator, new SchemaDiffer(), Clock.systemUTC());
  }

  /** @return the changes applied; empty when the schema was already in sync */
  public DiffResult run(QueryFn db, SchemaSnapshot current, String snapshotKey) {
    Objects.requireNonNull(db, "db");
    Objects.requireNonNull(current, "current");
    Objects.requireNonNull(snapshotKey, "snapshotKey");

    Optional<SchemaSnapshot> previous = storage.load(snapshotKey);
    if (previous.isEmpty()) log.info("strata.auto_migrate No previous snapshot found key={}", snapshotKey);

    runner.createHistoryTable(db);

    DiffResult diff = differ.diff(previous.orElse(SchemaSnapshot.empty()), current);
    if (diff.isEmpty()) {
      log.info("strata.auto_migrate No schema changes detected key={}", snapshotKey);
      return diff;
    }

    for (DiffChange c : diff.destructive()) warnDestructive(c);

    String sql = generator.generate(diff, current);
    if (!sql.isBlank()) {
      String name = previous.isEmpty() ? INITIAL_NAME : NAME_PREFIX + nextStamp();
      runner.apply(db, sql, name);
      log.info("strata.auto_migrate Applied {} change(s) name={}", diff.changes().size(), name);
    }

    storage.save(snapshotKey, current);
    log.info("strata.auto_migrate Snapshot saved key={}", snapshotKey);
    return diff;
  }

  /** Clock millis, bumped past the previous stamp so runs within one millisecond still get distinct names. */
  private long nextStamp() {
    long now = clock.millis();
    return lastStamp.updateAndGet(prev -> Math.max(prev + 1, now));
  }

  private static void warnDestructive(DiffChange c) {
    if (c instanceof DiffChange.TableRemoved t) {
      log.warn("strata.auto_migrate destructive change: dropping table {}", t.table());
    } else if (c instanceof DiffChange.ColumnRemoved r) {
      log.warn("strata.auto_migrate destructive change: dropping column {}.{}", r.table(), r.column());
    } else {
      log.warn("strata.auto_migrate destructive change: {}", c);
    }
  }
}
