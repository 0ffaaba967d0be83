package io.intellixity.strata.snapshot;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/** Canonical JSON serializer for {@link SchemaSnapshot}: {@code {version, tables, enums}}. */
public final class SnapshotJsonSerializer extends JsonSerializer<SchemaSnapshot> {
  @Override
  public void serialize(SchemaSnapshot s, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (s == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeNumberField("version", s.version());

    g.writeObjectFieldStart("tables");
    for (var te : s.tables().entrySet()) {
      g.writeObjectFieldStart(te.getKey());
      writeTable(te.getValue(), g);
      g.writeEndObject();
    }
    g.writeEndObject();

    g.writeObjectFieldStart("enums");
    for (Map.Entry<String, List<String>> ee : s.enums().entrySet()) {
      g.writeArrayFieldStart(ee.getKey());
      for (String v : ee.getValue()) g.writeString(v);
      g.writeEndArray();
    }
    g.writeEndObject();

    g.writeEndObject();
  }

  private static void writeTable(TableSnapshot t, JsonGenerator g) throws IOException {
    g.writeObjectFieldStart("columns");
    for (var ce : t.columns().entrySet()) {
      ColumnSnapshot c = ce.getValue();
      g.writeObjectFieldStart(ce.getKey());
      g.writeStringField("type", c.type());
      g.writeBooleanField("nullable", c.nullable());
      g.writeBooleanField("primary", c.primary());
      g.writeBooleanField("unique", c.unique());
      if (c.defaultValue() != null) g.writeStringField("default", c.defaultValue());
      if (c.sensitive()) g.writeBooleanField("sensitive", true);
      if (c.hidden()) g.writeBooleanField("hidden", true);
      g.writeEndObject();
    }
    g.writeEndObject();

    g.writeArrayFieldStart("indexes");
    for (IndexSnapshot i : t.indexes()) {
      g.writeStartObject();
      g.writeArrayFieldStart("columns");
      for (String c : i.columns()) g.writeString(c);
      g.writeEndArray();
      if (i.name() != null) g.writeStringField("name", i.name());
      if (i.unique()) g.writeBooleanField("unique", true);
      g.writeEndObject();
    }
    g.writeEndArray();

    g.writeArrayFieldStart("foreignKeys");
    for (ForeignKeySnapshot fk : t.foreignKeys()) {
      g.writeStartObject();
      g.writeStringField("column", fk.column());
      g.writeStringField("targetTable", fk.targetTable());
      g.writeStringField("targetColumn", fk.targetColumn());
      g.writeEndObject();
    }
    g.writeEndArray();
  }
}
