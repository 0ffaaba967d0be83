package io.intellixity.strata.migration;

import io.intellixity.strata.error.MigrationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/** Naming convention {@code NNNN_description.ext} and directory loading. */
public final class MigrationFiles {
  public static final String EXTENSION = ".sql";
  static final int SEQUENCE_WIDTH = 4;

  private static final Pattern NAME = Pattern.compile("^(\\d+)_(.+)\\.([A-Za-z0-9]+)$");
  private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");

  private MigrationFiles() {}

  public record ParsedName(long sequence, String description, String extension) {}

  public static Optional<ParsedName> parseName(String fileName) {
    if (fileName == null) return Optional.empty();
    Matcher m = NAME.matcher(fileName);
    if (!m.matches()) return Optional.empty();
    try {
      return Optional.of(new ParsedName(Long.parseLong(m.group(1)), m.group(2), m.group(3)));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  /** {@code formatName(3, "Add user email")} is {@code 0003_add_user_email.sql}. */
  public static String formatName(long sequence, String description) {
    return pad(sequence) + "_" + slug(description) + EXTENSION;
  }

  static String pad(long sequence) {
    return String.format(Locale.ROOT, "%0" + SEQUENCE_WIDTH + "d", sequence);
  }

  static String slug(String description) {
    String s = NON_SLUG.matcher(Objects.requireNonNull(description, "description").toLowerCase(Locale.ROOT))
        .replaceAll("_");
    s = s.replaceAll("^_+|_+$", "");
    if (s.isEmpty()) throw new IllegalArgumentException("Description yields an empty name: '" + description + "'");
    return s;
  }

  /**
   * Every {@code *.sql} file in {@code dir} that follows the naming convention, sorted by sequence then name.
   * Other files are ignored; a missing directory yields an empty list.
   */
  public static List<MigrationFile> load(Path dir) {
    Objects.requireNonNull(dir, "dir");
    if (!Files.isDirectory(dir)) return List.of();
    List<MigrationFile> out = new ArrayList<>();
    try (Stream<Path> entries = Files.list(dir)) {
      for (Path p : (Iterable<Path>) entries::iterator) {
        String name = p.getFileName().toString();
        if (!Files.isRegularFile(p) || !name.endsWith(EXTENSION)) continue;
        Optional<ParsedName> parsed = parseName(name);
        if (parsed.isEmpty()) continue;
        out.add(new MigrationFile(name, Files.readString(p, StandardCharsets.UTF_8), parsed.get().sequence()));
      }
    } catch (IOException e) {
      throw new MigrationException("Failed to read migration files from " + dir, null, e);
    }
    out.sort(ORDER);
    return out;
  }

  static final Comparator<MigrationFile> ORDER =
      Comparator.comparingLong(MigrationFile::sequence).thenComparing(MigrationFile::name);
}
