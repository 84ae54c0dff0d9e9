package io.hyprconf.shell;

import io.hyprconf.parser.HyprConf;
import io.hyprconf.parser.api.ConfigTree.Root;
import io.hyprconf.shell.io.ConfigFiles;
import io.hyprconf.shell.io.ServiceReloader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An opened config file: its parsed tree plus what is needed to write it back.
 *
 * <p>Callers mutate {@link #root()} in place and then {@link #save}. The session is modified when
 * the tree no longer serializes to what the freshly parsed file did.
 */
public final class ConfigSession {
  private static final Logger log = LoggerFactory.getLogger(ConfigSession.class);

  private final Path path;
  private final ConfigFiles files;
  private final String originalText;
  private final Root root;
  private String baseline;

  private ConfigSession(Path path, ConfigFiles files, String originalText) {
    this.path = path;
    this.files = files;
    this.originalText = originalText;
    this.root = HyprConf.parse(originalText);
    this.baseline = HyprConf.serialize(root);
  }

  /**
   * Reads and parses {@code path}.
   *
   * @throws io.hyprconf.parser.api.ConfigParseException if the file is not valid config text
   */
  public static ConfigSession open(Path path, ConfigFiles files) throws IOException {
    Objects.requireNonNull(path);
    Objects.requireNonNull(files);
    return new ConfigSession(path, files, files.read(path));
  }

  public Path path() {
    return path;
  }

  public Root root() {
    return root;
  }

  public String originalText() {
    return originalText;
  }

  public String text(boolean preserveComments) {
    return HyprConf.serialize(root, preserveComments);
  }

  public boolean isModified() {
    return !baseline.equals(HyprConf.serialize(root));
  }

  /** Writes the tree with comments preserved. */
  public Optional<Path> save(boolean backup, ServiceReloader reloader) throws IOException {
    return save(text(true), backup, reloader);
  }

  /**
   * Writes {@code text} to the session's file.
   *
   * @param backup copy the current file aside first, when it exists
   * @param reloader notified after writing, may be null
   * @return the backup location, when one was made
   */
  public Optional<Path> save(String text, boolean backup, ServiceReloader reloader)
      throws IOException {
    Path backupPath = null;
    if (backup && files.exists(path)) {
      backupPath = files.createBackup(path);
    }
    files.write(path, text);
    baseline = HyprConf.serialize(root);
    log.info("Saved {}", path);
    if (reloader != null) {
      reloader.reload();
    }
    return Optional.ofNullable(backupPath);
  }
}
