package io.hyprconf.shell.cli;

import io.hyprconf.parser.api.ConfigValue;
import io.hyprconf.parser.api.ConfigValue.StringValue;
import picocli.CommandLine;

/**
 * Reads a command line argument the way the same text would read after {@code key =}: booleans,
 * numbers and quoted literals keep their type, other text becomes a string that is quoted only
 * when it has to be.
 */
final class ConfigValueConverter implements CommandLine.ITypeConverter<ConfigValue> {
  @Override
  public ConfigValue convert(String value) {
    ConfigValue coerced = ConfigValue.coerce(value);
    if (coerced instanceof StringValue s && !s.isQuoted()) {
      return ConfigValue.of(value);
    }
    return coerced;
  }
}
