package io.intellixity.strata.spi.introspect;

import io.intellixity.strata.snapshot.SchemaSnapshot;
import io.intellixity.strata.spi.exec.QueryFn;

/**
 * Reads a live database's catalog into the same snapshot shape the declared schema produces.
 * Read-only; the migration history table is never part of the result.
 */
public interface SchemaIntrospector {
  /** Reserved migration history table. */
  String HISTORY_TABLE = "_strata_migrations";

  String dialectId();

  SchemaSnapshot introspect(QueryFn fn);
}
