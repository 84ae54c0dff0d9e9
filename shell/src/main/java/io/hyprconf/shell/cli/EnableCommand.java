package io.hyprconf.shell.cli;

import io.hyprconf.parser.api.ConfigEditor;
import io.hyprconf.parser.api.ConfigTree.Container;
import io.hyprconf.parser.api.ConfigTree.Root;
import io.hyprconf.parser.api.ConfigValue;
import java.util.Optional;
import picocli.CommandLine;

@CommandLine.Command(
    name = "enable",
    description = "Uncomment a setting, optionally changing its value",
    mixinStandardHelpOptions = true)
public final class EnableCommand extends EditCommand {

  @CommandLine.Parameters(index = "0", paramLabel = "PATH", converter = SettingPath.Converter.class)
  SettingPath path;

  @CommandLine.Parameters(
      index = "1",
      arity = "0..1",
      paramLabel = "VALUE",
      converter = ConfigValueConverter.class)
  ConfigValue value;

  @Override
  SettingPath target() {
    return path;
  }

  @Override
  int edit(Root root) {
    if (value != null) {
      ConfigEditor.setPropertyEnabled(path.ensure(root), path.key(), true, value);
      return 0;
    }
    Optional<Container> container = path.find(root);
    if (container.isEmpty()
        || !ConfigEditor.findPropertyOrCommented(container.get(), path.key()).isPresent()) {
      System.err.println("No setting at " + path + "; give a value to add it");
      return 1;
    }
    ConfigEditor.setPropertyEnabled(container.get(), path.key(), true);
    return 0;
  }
}
