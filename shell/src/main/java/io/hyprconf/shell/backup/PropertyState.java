package io.hyprconf.shell.backup;

import java.util.Objects;

/** Current and first-seen value and enablement of a tracked property. */
public record PropertyState(
    String value, boolean enabled, String originalValue, boolean originallyEnabled) {

  static PropertyState initial(String value, boolean enabled) {
    return new PropertyState(value, enabled, value, enabled);
  }

  PropertyState withCurrent(String newValue, boolean newEnabled) {
    return new PropertyState(newValue, newEnabled, originalValue, originallyEnabled);
  }

  /** The state this property had when it was first recorded. */
  public PropertyState original() {
    return initial(originalValue, originallyEnabled);
  }

  public boolean isModified() {
    return !Objects.equals(value, originalValue) || enabled != originallyEnabled;
  }
}
