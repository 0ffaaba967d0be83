package io.intellixity.strata.query;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Recursive boolean filter.
 * <p>
 * {@link And} is a conjunction: its children's clauses are joined with AND and it renders as
 * {@code TRUE} when empty (the root filter renders as no WHERE clause at all when it is an empty {@link And}).
 * {@link Or} renders as {@code FALSE} when empty. {@link Not} negates the conjunction of its child's clauses.
 */
public sealed interface WhereFilter permits WhereFilter.Comparison, WhereFilter.And, WhereFilter.Or, WhereFilter.Not {

  /**
   * @param column declared column name; {@code col->seg->seg} addresses a path inside a semi-structured column
   */
  record Comparison(String column, Operator operator, Object value) implements WhereFilter {
    public Comparison {
      Objects.requireNonNull(column, "column");
      Objects.requireNonNull(operator, "operator");
      if ((operator == Operator.IN || operator == Operator.NOT_IN) && !(value instanceof Collection<?>)) {
        throw new IllegalArgumentException(operator.key() + " requires a collection value for column " + column);
      }
      if (operator.isPattern() && !(value instanceof CharSequence)) {
        throw new IllegalArgumentException(operator.key() + " requires a string value for column " + column);
      }
      if (operator == Operator.IS_NULL && !(value instanceof Boolean)) {
        throw new IllegalArgumentException("isNull requires a boolean value for column " + column);
      }
    }
  }

  record And(List<WhereFilter> children) implements WhereFilter {
    public And {
      children = List.copyOf(children == null ? List.of() : children);
    }
  }

  record Or(List<WhereFilter> children) implements WhereFilter {
    public Or {
      children = List.copyOf(children == null ? List.of() : children);
    }
  }

  record Not(WhereFilter child) implements WhereFilter {
    public Not {
      Objects.requireNonNull(child, "child");
    }
  }

  /** True for a null filter or an empty {@link And}; multi-row mutations reject such filters. */
  static boolean isEmpty(WhereFilter f) {
    return f == null || (f instanceof And a && a.children().isEmpty());
  }
}
