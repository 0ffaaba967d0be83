package io.intellixity.strata.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores each snapshot as a JSON document; the key is a filesystem path,
 * resolved against {@code baseDir} when relative. Parent directories are created on save.
 */
public final class FileSnapshotStorage implements SnapshotStorage {
  private static final Logger log = LoggerFactory.getLogger(FileSnapshotStorage.class);
  private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private final Path baseDir;

  public FileSnapshotStorage() {
    this(Path.of(""));
  }

  public FileSnapshotStorage(Path baseDir) {
    this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
  }

  @Override
  public Optional<SchemaSnapshot> load(String key) {
    Path p = resolve(key);
    if (!Files.exists(p)) return Optional.empty();
    try {
      return Optional.ofNullable(JSON.readValue(p.toFile(), SchemaSnapshot.class));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read snapshot " + p, e);
    }
  }

  @Override
  public void save(String key, SchemaSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    Path p = resolve(key);
    try {
      Path parent = p.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      JSON.writeValue(p.toFile(), snapshot);
      log.debug("strata.snapshot saved path={} tables={} enums={}", p, snapshot.tables().size(), snapshot.enums().size());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write snapshot " + p, e);
    }
  }

  private Path resolve(String key) {
    Objects.requireNonNull(key, "key");
    return baseDir.resolve(key);
  }
}
