package io.intellixity.strata.diff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Ordered changes; the order is part of the result and drives DDL statement order. */
public record DiffResult(List<DiffChange> changes) {
  public DiffResult {
    changes = changes == null ? List.of() : List.copyOf(changes);
  }

  public boolean isEmpty() {
    return changes.isEmpty();
  }

  /** Each change inverted and the list replayed back to front. */
  public DiffResult reversed() {
    return new DiffResult(reverse(changes));
  }

  public List<DiffChange> destructive() {
    return changes.stream().filter(c -> c.type().isDestructive()).toList();
  }

  public static List<DiffChange> reverse(List<DiffChange> changes) {
    List<DiffChange> out = new ArrayList<>(changes.size());
    for (DiffChange c : changes) out.add(c.reverse());
    Collections.reverse(out);
    return out;
  }
}
