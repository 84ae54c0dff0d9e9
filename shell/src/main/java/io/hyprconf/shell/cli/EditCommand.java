package io.hyprconf.shell.cli;

import io.hyprconf.parser.api.ConfigEditor;
import io.hyprconf.parser.api.ConfigTree.Root;
import io.hyprconf.parser.api.ConfigTree.Setting;
import io.hyprconf.shell.ConfigSession;
import io.hyprconf.shell.Main;
import io.hyprconf.shell.backup.ConfigBackupManager;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Opens the config file, applies one edit to a single setting and writes the file back if the tree
 * changed.
 *
 * <p>A written edit is recorded with the backup manager: the file's first seen content becomes its
 * backup, and the setting's state before and after the edit goes into the change log.
 */
abstract class EditCommand implements Callable<Integer> {
  private static final Logger log = LoggerFactory.getLogger(EditCommand.class);

  @CommandLine.ParentCommand Main parent;

  @CommandLine.Mixin WriteOptions writeOptions = new WriteOptions();

  /** The setting this command edits. */
  abstract SettingPath target();

  /**
   * Applies the edit to {@code root}.
   *
   * @return the exit code; the file is only written for 0
   */
  abstract int edit(Root root);

  @Override
  public Integer call() throws IOException {
    ConfigSession session = ConfigSession.open(parent.configFile(), parent.files());
    Optional<Setting> before = current(session.root());
    int exitCode = edit(session.root());
    if (exitCode != 0) {
      return exitCode;
    }
    if (!session.isModified()) {
      log.debug("{} unchanged, not writing", session.path());
      return 0;
    }
    session
        .save(writeOptions.backup, writeOptions.reload ? parent.reloader() : null)
        .ifPresent(backup -> System.err.println("Backup written to " + backup));
    track(session, before, current(session.root()));
    return 0;
  }

  private Optional<Setting> current(Root root) {
    SettingPath path = target();
    return path.find(root)
        .flatMap(c -> ConfigEditor.findPropertyOrCommented(c, path.key()).current());
  }

  private void track(ConfigSession session, Optional<Setting> before, Optional<Setting> after) {
    ConfigBackupManager backups = parent.backups();
    String file = session.path().toAbsolutePath().toString();
    String property = target().toString();
    if (backups.restoreFile(file).isEmpty()) {
      backups.createBackup(file, session.originalText());
    }
    // a setting first seen now starts its history at the written state
    before.ifPresent(
        s -> backups.setPropertyState(file, property, s.value().text(), s.isEnabled()));
    after.ifPresent(
        s -> {
          if (before.isPresent()) {
            backups.updatePropertyState(file, property, s.value().text(), s.isEnabled());
          } else {
            backups.setPropertyState(file, property, s.value().text(), s.isEnabled());
          }
        });
  }
}
