package io.hyprconf.shell.settings;

import io.hyprconf.parser.HyprConf;
import io.hyprconf.parser.api.ConfigEditor;
import io.hyprconf.parser.api.ConfigTree.Block;
import io.hyprconf.parser.api.ConfigTree.Container;
import io.hyprconf.parser.api.ConfigTree.Root;
import io.hyprconf.parser.api.PropertyLookup;
import io.hyprconf.shell.backup.ConfigBackupManager;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed view of the keyboard, pointer and touchpad settings in an {@code input { ... }} block.
 *
 * <p>Creating a manager records the content as the file's backup and the current state of every
 * known key, so later updates show up in the backup manager's change log.
 */
public final class InputConfigManager {
  private static final Logger log = LoggerFactory.getLogger(InputConfigManager.class);

  static final String INPUT_BLOCK = "input";

  private final String originalContent;
  private final String filePath;
  private final ConfigBackupManager backups;
  private final Root root;

  public InputConfigManager(String content, String filePath, ConfigBackupManager backups) {
    this.originalContent = Objects.requireNonNull(content);
    this.filePath = Objects.requireNonNull(filePath);
    this.backups = Objects.requireNonNull(backups);
    this.root = HyprConf.parse(content);
    backups.createBackup(filePath, content);
    for (Map.Entry<InputKey, SettingState> e : getSettings().entrySet()) {
      backups.setPropertyState(
          filePath, e.getKey().trackingName(), e.getValue().value().text(), e.getValue().enabled());
    }
  }

  /** Keys present in the config, active or commented out. Absent keys are not in the map. */
  public Map<InputKey, SettingState> getSettings() {
    Map<InputKey, SettingState> settings = new EnumMap<>(InputKey.class);
    Optional<Block> input = ConfigEditor.findBlock(root, INPUT_BLOCK);
    if (input.isEmpty()) {
      return settings;
    }
    for (InputKey key : InputKey.values()) {
      Optional<Block> container =
          key.block() == null ? input : ConfigEditor.findBlock(input.get(), key.block());
      container
          .map(block -> ConfigEditor.findPropertyOrCommented(block, key.key()))
          .flatMap(PropertyLookup::current)
          .ifPresent(s -> settings.put(key, new SettingState(s.value(), s.isEnabled())));
    }
    return settings;
  }

  /** Applies the given states, creating the {@code input} and touchpad blocks as needed. */
  public void updateSettings(Map<InputKey, SettingState> changes) {
    Block input = ConfigEditor.ensureBlock(root, INPUT_BLOCK);
    for (Map.Entry<InputKey, SettingState> e : changes.entrySet()) {
      InputKey key = e.getKey();
      SettingState state = e.getValue();
      Container container =
          key.block() == null ? input : ConfigEditor.ensureBlock(input, key.block());
      ConfigEditor.setPropertyEnabled(container, key.key(), state.enabled(), state.value());
      // disabling keeps the line's own value, so track what the tree holds now
      ConfigEditor.findPropertyOrCommented(container, key.key())
          .current()
          .ifPresentOrElse(
              s ->
                  backups.updatePropertyState(
                      filePath, key.trackingName(), s.value().text(), s.isEnabled()),
              () -> log.debug("Nothing to disable for {}", key.trackingName()));
    }
  }

  public String serialize(boolean preserveComments) {
    return HyprConf.serialize(root, preserveComments);
  }

  public String serialize() {
    return serialize(true);
  }

  public String getOriginalContent() {
    return originalContent;
  }

  Root root() {
    return root;
  }

  /** Range checks for the numeric keys. Keys not in {@code settings} are not checked. */
  public static ValidationResult validate(Map<InputKey, SettingState> settings) {
    List<String> errors = new ArrayList<>();
    checkRange(settings, InputKey.REPEAT_RATE, 1, 100, "between 1 and 100", errors);
    checkRange(settings, InputKey.REPEAT_DELAY, 100, 2000, "between 100 and 2000ms", errors);
    checkRange(settings, InputKey.SENSITIVITY, -2, 2, "between -2 and 2", errors);
    checkRange(settings, InputKey.SCROLL_FACTOR, 0.1, 5, "between 0.1 and 5", errors);
    return ValidationResult.of(errors);
  }

  private static void checkRange(
      Map<InputKey, SettingState> settings,
      InputKey key,
      double min,
      double max,
      String range,
      List<String> errors) {
    SettingState state = settings.get(key);
    if (state == null) {
      return;
    }
    double value = state.number().orElse(Double.NaN);
    if (Double.isNaN(value)) {
      errors.add(key.key() + " must be a number");
    } else if (value < min || value > max) {
      errors.add(key.key() + " must be " + range);
    }
  }
}
