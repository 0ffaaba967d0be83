package io.intellixity.strata.jdbc.sql;

import java.util.List;

/**
 * Requested aggregations, all by declared column name. {@code countAll} and per-column
 * {@code count} are exclusive.
 */
public record AggregateFields(
    boolean countAll,
    List<String> count,
    List<String> avg,
    List<String> sum,
    List<String> min,
    List<String> max
) {
  public AggregateFields {
    count = count == null ? List.of() : List.copyOf(count);
    avg = avg == null ? List.of() : List.copyOf(avg);
    sum = sum == null ? List.of() : List.copyOf(sum);
    min = min == null ? List.of() : List.copyOf(min);
    max = max == null ? List.of() : List.copyOf(max);
    if (countAll && !count.isEmpty()) {
      throw new IllegalArgumentException("_count is either all rows or a set of columns, not both");
    }
  }

  public static AggregateFields countOnly() {
    return new AggregateFields(true, null, null, null, null, null);
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isEmpty() {
    return !countAll && count.isEmpty() && avg.isEmpty() && sum.isEmpty() && min.isEmpty() && max.isEmpty();
  }

  public static final class Builder {
    private boolean countAll;
    private List<String> count;
    private List<String> avg;
    private List<String> sum;
    private List<String> min;
    private List<String> max;

    public Builder countAll() { this.countAll = true; return this; }
    public Builder count(String... cols) { this.count = List.of(cols); return this; }
    public Builder avg(String... cols) { this.avg = List.of(cols); return this; }
    public Builder sum(String... cols) { this.sum = List.of(cols); return this; }
    public Builder min(String... cols) { this.min = List.of(cols); return this; }
    public Builder max(String... cols) { this.max = List.of(cols); return this; }

    public AggregateFields build() {
      return new AggregateFields(countAll, count, avg, sum, min, max);
    }
  }
}
