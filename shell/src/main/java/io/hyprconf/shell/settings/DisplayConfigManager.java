package io.hyprconf.shell.settings;

import io.hyprconf.parser.HyprConf;
import io.hyprconf.parser.api.ConfigEditor;
import io.hyprconf.parser.api.ConfigTree.CommentedProperty;
import io.hyprconf.parser.api.ConfigTree.Node;
import io.hyprconf.parser.api.ConfigTree.Property;
import io.hyprconf.parser.api.ConfigTree.Root;
import io.hyprconf.parser.api.ConfigTree.Setting;
import io.hyprconf.parser.api.ConfigValue;
import io.hyprconf.shell.backup.ConfigBackupManager;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed view of the scale and monitor lines of a display config.
 *
 * <p>{@code env} and {@code monitor} are repeated keys, so entries are addressed by node rather
 * than by key: the {@code GDK_SCALE} entry is the first active {@code env = GDK_SCALE,...} line,
 * or the first commented one when none is active, and the two monitors are the first two {@code
 * monitor} lines in file order. Entries are toggled where they stand. New entries go after the
 * last line with the same key, or at the end of the file.
 */
public final class DisplayConfigManager {
  static final String ENV = "env";
  static final String MONITOR = "monitor";
  static final String SCALE_VARIABLE = "GDK_SCALE";

  private static final String MONITOR_FORMAT_ERROR =
      "Monitor configuration must follow format: port,resolution,position,scale";

  private final String originalContent;
  private final String filePath;
  private final ConfigBackupManager backups;
  private Root root;

  public DisplayConfigManager(String content, String filePath, ConfigBackupManager backups) {
    this.originalContent = Objects.requireNonNull(content);
    this.filePath = Objects.requireNonNull(filePath);
    this.backups = Objects.requireNonNull(backups);
    this.root = HyprConf.parse(content);
    backups.createBackup(filePath, content);
    for (Map.Entry<DisplayKey, SettingState> e : getSettings().entrySet()) {
      backups.setPropertyState(
          filePath, e.getKey().trackingName(), e.getValue().value().text(), e.getValue().enabled());
    }
  }

  public Map<DisplayKey, SettingState> getSettings() {
    Map<DisplayKey, SettingState> settings = new EnumMap<>(DisplayKey.class);
    findScale()
        .ifPresent(
            s ->
                settings.put(
                    DisplayKey.GDK_SCALE,
                    new SettingState(ConfigValue.coerce(envValue(s)), s.isEnabled())));
    List<Setting> monitors = monitors();
    if (monitors.size() > 0) {
      settings.put(DisplayKey.MONITOR_PRIMARY, stateOf(monitors.get(0)));
    }
    if (monitors.size() > 1) {
      settings.put(DisplayKey.MONITOR_SECONDARY, stateOf(monitors.get(1)));
    }
    return settings;
  }

  /**
   * Enables or disables one display setting.
   *
   * @param value the new value, or null to keep the current one
   * @throws IllegalArgumentException if the entry does not exist yet and no value is given
   */
  public void updateSetting(DisplayKey key, String value, boolean enabled) {
    Objects.requireNonNull(key);
    Optional<Setting> existing;
    ConfigValue newValue;
    String lineKey;
    if (key == DisplayKey.GDK_SCALE) {
      existing = findScale();
      newValue = value == null ? null : ConfigValue.of(SCALE_VARIABLE + "," + value.trim());
      lineKey = ENV;
    } else {
      List<Setting> monitors = monitors();
      int index = key == DisplayKey.MONITOR_PRIMARY ? 0 : 1;
      existing = index < monitors.size() ? Optional.of(monitors.get(index)) : Optional.empty();
      newValue = value == null ? null : ConfigValue.of(value.trim());
      lineKey = MONITOR;
    }

    if (existing.isPresent()) {
      ConfigEditor.setSettingEnabled(root, existing.get(), enabled, newValue);
    } else if (newValue == null) {
      throw new IllegalArgumentException("A value is required to add " + key.trackingName());
    } else {
      Setting created =
          enabled ? new Property(lineKey, newValue) : new CommentedProperty(lineKey, newValue);
      root.children().add(insertionIndex(lineKey), created);
    }
    SettingState now = getSettings().get(key);
    if (now != null) {
      backups.updatePropertyState(filePath, key.trackingName(), now.value().text(), now.enabled());
    }
  }

  public String serialize() {
    return HyprConf.serialize(root, true);
  }

  public String getOriginalContent() {
    return originalContent;
  }

  /** Discards all updates. */
  public void restoreOriginal() {
    root = HyprConf.parse(originalContent);
  }

  Root root() {
    return root;
  }

  public static ValidationResult validate(Map<DisplayKey, SettingState> settings) {
    List<String> errors = new ArrayList<>();
    SettingState scale = settings.get(DisplayKey.GDK_SCALE);
    if (scale != null && !scale.value().text().isEmpty()) {
      double value = scale.number().orElse(Double.NaN);
      if (Double.isNaN(value) || value <= 0 || value > 4) {
        errors.add("GDK_SCALE must be a positive number between 0 and 4");
      }
    }
    for (DisplayKey key : List.of(DisplayKey.MONITOR_PRIMARY, DisplayKey.MONITOR_SECONDARY)) {
      SettingState monitor = settings.get(key);
      if (monitor != null
          && !monitor.value().text().isEmpty()
          && !monitor.value().text().contains(",")) {
        errors.add(MONITOR_FORMAT_ERROR);
      }
    }
    return ValidationResult.of(errors);
  }

  private Optional<Setting> findScale() {
    Setting commented = null;
    for (Node node : root.children()) {
      if (node instanceof Setting setting && isScaleEntry(setting)) {
        if (setting.isEnabled()) {
          return Optional.of(setting);
        }
        if (commented == null) {
          commented = setting;
        }
      }
    }
    return Optional.ofNullable(commented);
  }

  private List<Setting> monitors() {
    List<Setting> monitors = new ArrayList<>();
    for (Node node : root.children()) {
      if (node instanceof Setting setting && setting.key().equals(MONITOR)) {
        monitors.add(setting);
      }
    }
    return monitors;
  }

  private int insertionIndex(String lineKey) {
    List<Node> children = root.children();
    for (int i = children.size() - 1; i >= 0; i--) {
      if (children.get(i) instanceof Setting setting && setting.key().equals(lineKey)) {
        return i + 1;
      }
    }
    return children.size();
  }

  private static boolean isScaleEntry(Setting setting) {
    if (!setting.key().equals(ENV)) {
      return false;
    }
    String text = setting.value().text();
    int comma = text.indexOf(',');
    return comma >= 0 && text.substring(0, comma).trim().equals(SCALE_VARIABLE);
  }

  private static String envValue(Setting setting) {
    String text = setting.value().text();
    return text.substring(text.indexOf(',') + 1).trim();
  }

  private static SettingState stateOf(Setting monitor) {
    return new SettingState(monitor.value(), monitor.isEnabled());
  }
}
