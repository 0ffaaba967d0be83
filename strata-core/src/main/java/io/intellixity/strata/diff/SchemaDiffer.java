package io.intellixity.strata.diff;

import io.intellixity.strata.diff.DiffChange.*;
import io.intellixity.strata.snapshot.ColumnSnapshot;
import io.intellixity.strata.snapshot.IndexSnapshot;
import io.intellixity.strata.snapshot.SchemaSnapshot;
import io.intellixity.strata.snapshot.TableSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Pure function from (before, after) snapshots to an ordered change list.
 *
 * Order:
 * <ul>
 *   <li>tables added, then tables removed</li>
 *   <li>per shared table: renames, remaining column adds, remaining column removes, alterations,
 *   index adds, index removes</li>
 *   <li>enums added, removed, altered</li>
 * </ul>
 * <p>
 * Rename detection pairs each removed column (in declaration order) with the best-scoring unmatched added
 * column. Only a strictly higher score replaces the current best, so among tied candidates the first one
 * in declaration order wins. Pairs scoring below {@link #RENAME_THRESHOLD} stay add/remove.
 */
public final class SchemaDiffer {
  private static final Logger log = LoggerFactory.getLogger(SchemaDiffer.class);

  public static final double RENAME_THRESHOLD = 0.7;

  public DiffResult diff(SchemaSnapshot before, SchemaSnapshot after) {
    Objects.requireNonNull(before, "before");
    Objects.requireNonNull(after, "after");
    List<DiffChange> changes = new ArrayList<>();

    for (String t : after.tables().keySet()) {
      if (!before.tables().containsKey(t)) changes.add(new TableAdded(t));
    }
    for (String t : before.tables().keySet()) {
      if (!after.tables().containsKey(t)) changes.add(new TableRemoved(t));
    }

    for (var e : after.tables().entrySet()) {
      TableSnapshot b = before.tables().get(e.getKey());
      if (b == null) continue;
      diffTable(e.getKey(), b, e.getValue(), changes);
    }

    diffEnums(before.enums(), after.enums(), changes);
    return new DiffResult(changes);
  }

  private void diffTable(String table, TableSnapshot before, TableSnapshot after, List<DiffChange> out) {
    List<String> removed = new ArrayList<>();
    for (String c : before.columns().keySet()) if (!after.columns().containsKey(c)) removed.add(c);
    List<String> added = new ArrayList<>();
    for (String c : after.columns().keySet()) if (!before.columns().containsKey(c)) added.add(c);

    Set<String> matchedRemoved = new HashSet<>();
    Set<String> matchedAdded = new HashSet<>();
    for (String r : removed) {
      ColumnSnapshot rs = before.columns().get(r);
      String best = null;
      double bestScore = 0;
      for (String a : added) {
        if (matchedAdded.contains(a)) continue;
        double s = ColumnSimilarity.score(rs, after.columns().get(a));
        if (s > bestScore) {
          bestScore = s;
          best = a;
        }
      }
      if (best != null && bestScore >= RENAME_THRESHOLD) {
        matchedRemoved.add(r);
        matchedAdded.add(best);
        out.add(new ColumnRenamed(table, r, best, bestScore));
        log.debug("strata.diff rename table={} from={} to={} confidence={}", table, r, best, bestScore);
      }
    }

    for (String a : added) if (!matchedAdded.contains(a)) out.add(new ColumnAdded(table, a));
    for (String r : removed) if (!matchedRemoved.contains(r)) out.add(new ColumnRemoved(table, r));

    for (var ce : after.columns().entrySet()) {
      ColumnSnapshot bc = before.columns().get(ce.getKey());
      if (bc == null) continue;
      ColumnSnapshot ac = ce.getValue();
      FieldChange<String> type = Objects.equals(bc.type(), ac.type()) ? null : new FieldChange<>(bc.type(), ac.type());
      FieldChange<Boolean> nullable = bc.nullable() == ac.nullable() ? null : new FieldChange<>(bc.nullable(), ac.nullable());
      FieldChange<String> def = Objects.equals(bc.defaultValue(), ac.defaultValue())
          ? null : new FieldChange<>(bc.defaultValue(), ac.defaultValue());
      if (type != null || nullable != null || def != null) {
        out.add(new ColumnAltered(table, ce.getKey(), type, nullable, def));
      }
    }

    Set<String> beforeIdx = new HashSet<>();
    for (IndexSnapshot i : before.indexes()) beforeIdx.add(i.key());
    Set<String> afterIdx = new HashSet<>();
    for (IndexSnapshot i : after.indexes()) afterIdx.add(i.key());
    for (IndexSnapshot i : after.indexes()) {
      if (!beforeIdx.contains(i.key())) out.add(new IndexAdded(table, i.columns()));
    }
    for (IndexSnapshot i : before.indexes()) {
      if (!afterIdx.contains(i.key())) out.add(new IndexRemoved(table, i.columns()));
    }
  }

  private static void diffEnums(Map<String, List<String>> before, Map<String, List<String>> after, List<DiffChange> out) {
    for (String n : after.keySet()) if (!before.containsKey(n)) out.add(new EnumAdded(n));
    for (String n : before.keySet()) if (!after.containsKey(n)) out.add(new EnumRemoved(n));
    for (var e : after.entrySet()) {
      List<String> b = before.get(e.getKey());
      if (b == null) continue;
      Set<String> bs = new HashSet<>(b);
      Set<String> as = new HashSet<>(e.getValue());
      List<String> addedValues = e.getValue().stream().filter(v -> !bs.contains(v)).toList();
      List<String> removedValues = b.stream().filter(v -> !as.contains(v)).toList();
      if (!addedValues.isEmpty() || !removedValues.isEmpty()) {
        out.add(new EnumAltered(e.getKey(), addedValues, removedValues));
      }
    }
  }
}
