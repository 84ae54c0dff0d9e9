package io.hyprconf.shell.settings;

import io.hyprconf.parser.api.ConfigValue;
import io.hyprconf.parser.api.NumericLiterals;
import java.util.Objects;
import java.util.OptionalDouble;

/** A setting's value and whether it is active or commented out. */
public record SettingState(ConfigValue value, boolean enabled) {

  public SettingState {
    Objects.requireNonNull(value, "value");
  }

  public static SettingState of(String value, boolean enabled) {
    return new SettingState(ConfigValue.of(value), enabled);
  }

  public static SettingState of(double value, boolean enabled) {
    return new SettingState(ConfigValue.of(value), enabled);
  }

  public static SettingState of(boolean value, boolean enabled) {
    return new SettingState(ConfigValue.of(value), enabled);
  }

  /** The value as a number, if its text is a numeric literal. */
  public OptionalDouble number() {
    String text = value.text();
    return NumericLiterals.isNumeric(text)
        ? OptionalDouble.of(NumericLiterals.toDouble(text))
        : OptionalDouble.empty();
  }
}
