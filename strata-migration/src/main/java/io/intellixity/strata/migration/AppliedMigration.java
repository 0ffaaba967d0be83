package io.intellixity.strata.migration;

import java.sql.Timestamp;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Objects;

/** One history row. */
public record AppliedMigration(String name, String checksum, Instant appliedAt) {
  public AppliedMigration {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(checksum, "checksum");
  }

  /**
   * Whatever the driver returned for {@code applied_at}; null stays null.
   * Text without an offset (the embedded backend's {@code yyyy-MM-dd HH:mm:ss}) is read as UTC.
   */
  static Instant toInstant(Object v) {
    if (v == null) return null;
    if (v instanceof Instant i) return i;
    if (v instanceof OffsetDateTime o) return o.toInstant();
    if (v instanceof ZonedDateTime z) return z.toInstant();
    if (v instanceof LocalDateTime l) return l.toInstant(ZoneOffset.UTC);
    if (v instanceof Timestamp t) return t.toInstant();
    if (v instanceof Date d) return d.toInstant();
    if (v instanceof Number n) return Instant.ofEpochMilli(n.longValue());
    String iso = v.toString().trim().replace(' ', 'T');
    TemporalAccessor t = DateTimeFormatter.ISO_DATE_TIME.parseBest(iso, OffsetDateTime::from, LocalDateTime::from);
    return t instanceof OffsetDateTime o ? o.toInstant() : ((LocalDateTime) t).toInstant(ZoneOffset.UTC);
  }
}
