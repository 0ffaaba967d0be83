package io.intellixity.strata.migration.journal;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** Reads and writes the journal document ({@code _journal.json} in the migrations directory). */
public final class JournalStore {
  public static final String JOURNAL_FILE = "_journal.json";

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private JournalStore() {}

  public static Path inDirectory(Path migrationsDir) {
    return migrationsDir.resolve(JOURNAL_FILE);
  }

  /** An absent file reads as {@link Journal#empty()}; malformed JSON fails. */
  public static Journal read(Path path) {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) return Journal.empty();
    try {
      Journal j = MAPPER.readValue(path.toFile(), Journal.class);
      if (j == null) throw new IOException("Empty journal document: " + path);
      return j;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read journal " + path, e);
    }
  }

  public static void write(Path path, Journal journal) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(journal, "journal");
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      MAPPER.writeValue(path.toFile(), journal);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write journal " + path, e);
    }
  }
}
