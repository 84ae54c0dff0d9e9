package io.hyprconf.shell.cli;

import io.hyprconf.parser.api.ConfigEditor;
import io.hyprconf.parser.api.ConfigTree.Root;
import io.hyprconf.parser.api.ConfigValue;
import picocli.CommandLine;

@CommandLine.Command(
    name = "set",
    description = "Enable a setting with the given value, adding it when absent",
    mixinStandardHelpOptions = true)
public final class SetCommand extends EditCommand {

  @CommandLine.Parameters(index = "0", paramLabel = "PATH", converter = SettingPath.Converter.class)
  SettingPath path;

  @CommandLine.Parameters(index = "1", paramLabel = "VALUE", converter = ConfigValueConverter.class)
  ConfigValue value;

  @Override
  SettingPath target() {
    return path;
  }

  @Override
  int edit(Root root) {
    ConfigEditor.setPropertyEnabled(path.ensure(root), path.key(), true, value);
    return 0;
  }
}
