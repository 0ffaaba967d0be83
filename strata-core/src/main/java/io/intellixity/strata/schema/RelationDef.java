package io.intellixity.strata.schema;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Declared relationship from one table to another.
 * <p>
 * {@link Kind#ONE}: the foreign key lives on the owning table and points at the target's primary key.<br>
 * {@link Kind#MANY}: the foreign key lives on the target table and points back at the owner's primary key,
 * unless {@link #through()} is set, in which case both sides are joined through a join table.
 * <p>
 * The target is resolved lazily so that mutually-referencing tables can be declared in any order.
 */
public record RelationDef(Kind kind, String foreignKey, Supplier<TableDef> target, Through through) {
  public enum Kind { ONE, MANY }

  /**
   * Join-table descriptor for many-to-many relations.
   *
   * @param thisKey join-table column pointing at the owning table
   * @param thatKey join-table column pointing at the target table
   */
  public record Through(Supplier<TableDef> table, String thisKey, String thatKey) {
    public Through {
      Objects.requireNonNull(table, "table");
      Objects.requireNonNull(thisKey, "thisKey");
      Objects.requireNonNull(thatKey, "thatKey");
    }
  }

  public RelationDef {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(target, "target");
    if (through == null) Objects.requireNonNull(foreignKey, "foreignKey");
    if (through != null && kind != Kind.MANY) {
      throw new IllegalArgumentException("Join-table relations must be MANY");
    }
  }

  public static RelationDef one(Supplier<TableDef> target, String foreignKey) {
    return new RelationDef(Kind.ONE, foreignKey, target, null);
  }

  public static RelationDef many(Supplier<TableDef> target, String foreignKey) {
    return new RelationDef(Kind.MANY, foreignKey, target, null);
  }

  public static RelationDef manyThrough(Supplier<TableDef> target, Supplier<TableDef> joinTable,
                                        String thisKey, String thatKey) {
    return new RelationDef(Kind.MANY, null, target, new Through(joinTable, thisKey, thatKey));
  }

  public TableDef targetTable() {
    return Objects.requireNonNull(target.get(), "relation target resolved to null");
  }

  public boolean isManyToMany() { return through != null; }
}
