package io.hyprconf.shell.backup;

/**
 * One recorded edit of a tracked property.
 *
 * @param wasCommented whether the property was disabled before the edit
 * @param isCommented whether it is disabled after the edit
 * @param timestamp epoch millis
 */
public record ConfigChange(
    String property,
    String oldValue,
    String newValue,
    boolean wasCommented,
    boolean isCommented,
    long timestamp) {}
