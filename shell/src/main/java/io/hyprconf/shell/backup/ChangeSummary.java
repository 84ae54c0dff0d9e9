package io.hyprconf.shell.backup;

/**
 * Counts of modified properties, and of those that were switched on or off relative to their
 * original state.
 */
public record ChangeSummary(int modified, int enabled, int disabled) {
  public static final ChangeSummary EMPTY = new ChangeSummary(0, 0, 0);
}
