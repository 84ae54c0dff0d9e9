package io.hyprconf.shell.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes configuration files as UTF-8 text.
 *
 * <p>Backups are plain copies next to the original named {@code <file>.backup.<epochMillis>}.
 */
public final class ConfigFiles {
  private static final Logger log = LoggerFactory.getLogger(ConfigFiles.class);

  static final String BACKUP_INFIX = ".backup.";

  private final Clock clock;

  public ConfigFiles() {
    this(Clock.systemUTC());
  }

  public ConfigFiles(Clock clock) {
    this.clock = Objects.requireNonNull(clock);
  }

  public String read(Path path) throws IOException {
    try {
      return Files.readString(path, StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      throw new NoSuchFileException(path.toString(), null, "Config file not found");
    } catch (IOException e) {
      throw new IOException("Failed to read " + path + ": " + e.getMessage(), e);
    }
  }

  public void write(Path path, String text) throws IOException {
    Objects.requireNonNull(text);
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(path, text, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IOException("Failed to write " + path + ": " + e.getMessage(), e);
    }
    log.debug("Wrote {} characters to {}", text.length(), path);
  }

  public boolean exists(Path path) {
    return Files.isRegularFile(path);
  }

  /**
   * Copies {@code path} to a timestamped sibling.
   *
   * @return the backup location
   */
  public Path createBackup(Path path) throws IOException {
    Path backup = path.resolveSibling(path.getFileName() + BACKUP_INFIX + clock.millis());
    try {
      Files.copy(path, backup, StandardCopyOption.COPY_ATTRIBUTES);
    } catch (IOException e) {
      throw new IOException("Failed to back up " + path + ": " + e.getMessage(), e);
    }
    log.info("Backed up {} to {}", path, backup);
    return backup;
  }
}
