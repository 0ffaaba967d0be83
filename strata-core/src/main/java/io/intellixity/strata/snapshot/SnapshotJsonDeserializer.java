package io.intellixity.strata.snapshot;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.*;

/** Canonical JSON deserializer for {@link SchemaSnapshot}. Missing sections read as empty. */
public final class SnapshotJsonDeserializer extends JsonDeserializer<SchemaSnapshot> {
  @Override
  public SchemaSnapshot deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw JsonMappingException.from(p, "Snapshot JSON must be an object");

    int version = root.path("version").asInt(SchemaSnapshot.CURRENT_VERSION);

    Map<String, TableSnapshot> tables = new LinkedHashMap<>();
    JsonNode tablesNode = root.get("tables");
    if (tablesNode != null && tablesNode.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = tablesNode.fields();
      while (it.hasNext()) {
        var e = it.next();
        tables.put(e.getKey(), readTable(e.getValue()));
      }
    }

    Map<String, List<String>> enums = new LinkedHashMap<>();
    JsonNode enumsNode = root.get("enums");
    if (enumsNode != null && enumsNode.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = enumsNode.fields();
      while (it.hasNext()) {
        var e = it.next();
        enums.put(e.getKey(), strings(e.getValue()));
      }
    }

    return new SchemaSnapshot(version, tables, enums);
  }

  private static TableSnapshot readTable(JsonNode t) {
    Map<String, ColumnSnapshot> columns = new LinkedHashMap<>();
    JsonNode cols = t.get("columns");
    if (cols != null && cols.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = cols.fields();
      while (it.hasNext()) {
        var e = it.next();
        JsonNode c = e.getValue();
        JsonNode def = c.get("default");
        columns.put(e.getKey(), new ColumnSnapshot(
            c.path("type").asText(),
            c.path("nullable").asBoolean(false),
            c.path("primary").asBoolean(false),
            c.path("unique").asBoolean(false),
            (def == null || def.isNull()) ? null : def.asText(),
            c.path("sensitive").asBoolean(false),
            c.path("hidden").asBoolean(false)));
      }
    }

    List<IndexSnapshot> indexes = new ArrayList<>();
    JsonNode idx = t.get("indexes");
    if (idx != null && idx.isArray()) {
      for (JsonNode i : idx) {
        JsonNode name = i.get("name");
        indexes.add(new IndexSnapshot(strings(i.get("columns")),
            (name == null || name.isNull()) ? null : name.asText(),
            i.path("unique").asBoolean(false)));
      }
    }

    List<ForeignKeySnapshot> fks = new ArrayList<>();
    JsonNode fkNode = t.get("foreignKeys");
    if (fkNode != null && fkNode.isArray()) {
      for (JsonNode fk : fkNode) {
        fks.add(new ForeignKeySnapshot(
            fk.path("column").asText(),
            fk.path("targetTable").asText(),
            fk.path("targetColumn").asText()));
      }
    }

    return new TableSnapshot(columns, indexes, fks);
  }

  private static List<String> strings(JsonNode arr) {
    if (arr == null || !arr.isArray()) return List.of();
    List<String> out = new ArrayList<>(arr.size());
    for (JsonNode v : arr) out.add(v.asText());
    return out;
  }
}
