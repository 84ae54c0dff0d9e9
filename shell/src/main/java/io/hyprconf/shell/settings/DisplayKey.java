package io.hyprconf.shell.settings;

/** The display settings handled by {@link DisplayConfigManager}. */
public enum DisplayKey {
  /** {@code env = GDK_SCALE,<value>}. */
  GDK_SCALE,
  /** The first top-level {@code monitor} entry, active or commented out. */
  MONITOR_PRIMARY,
  /** The second top-level {@code monitor} entry. */
  MONITOR_SECONDARY;

  public String trackingName() {
    return name().toLowerCase(java.util.Locale.ROOT);
  }
}
