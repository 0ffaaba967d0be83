package io.intellixity.strata.diff;

import io.intellixity.strata.snapshot.ColumnSnapshot;

import java.util.Objects;

/** Weighted structural similarity between two columns, in [0, 1]. */
public final class ColumnSimilarity {
  static final int TYPE_WEIGHT = 3;
  static final int FLAG_WEIGHT = 1;
  private static final int TOTAL = TYPE_WEIGHT + 3 * FLAG_WEIGHT;

  private ColumnSimilarity() {}

  public static double score(ColumnSnapshot a, ColumnSnapshot b) {
    int s = 0;
    if (Objects.equals(a.type(), b.type())) s += TYPE_WEIGHT;
    if (a.nullable() == b.nullable()) s += FLAG_WEIGHT;
    if (a.primary() == b.primary()) s += FLAG_WEIGHT;
    if (a.unique() == b.unique()) s += FLAG_WEIGHT;
    return (double) s / TOTAL;
  }
}
