package io.hyprconf.shell.cli;

import io.hyprconf.parser.api.ConfigEditor;
import io.hyprconf.parser.api.ConfigTree.Container;
import io.hyprconf.parser.api.ConfigTree.Root;
import java.util.Optional;
import picocli.CommandLine;

@CommandLine.Command(
    name = "disable",
    description = "Comment out a setting, keeping its value",
    mixinStandardHelpOptions = true)
public final class DisableCommand extends EditCommand {

  @CommandLine.Parameters(index = "0", paramLabel = "PATH", converter = SettingPath.Converter.class)
  SettingPath path;

  @Override
  SettingPath target() {
    return path;
  }

  @Override
  int edit(Root root) {
    Optional<Container> container = path.find(root);
    if (container.isEmpty()
        || !ConfigEditor.findPropertyOrCommented(container.get(), path.key()).isPresent()) {
      System.err.println("No setting at " + path);
      return 1;
    }
    ConfigEditor.setPropertyEnabled(container.get(), path.key(), false);
    return 0;
  }
}
