package io.hyprconf.shell.cli;

import io.hyprconf.parser.api.ConfigEditor;
import io.hyprconf.parser.api.ConfigTree.Setting;
import io.hyprconf.parser.api.PropertyLookup;
import io.hyprconf.shell.ConfigSession;
import io.hyprconf.shell.Main;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "get",
    description = "Print a setting's value and whether it is enabled",
    mixinStandardHelpOptions = true)
public final class GetCommand implements Callable<Integer> {

  @CommandLine.ParentCommand Main parent;

  @CommandLine.Parameters(
      index = "0",
      paramLabel = "PATH",
      converter = SettingPath.Converter.class,
      description = "Setting path, e.g. input/touchpad/natural_scroll")
  SettingPath path;

  @Override
  public Integer call() throws IOException {
    ConfigSession session = ConfigSession.open(parent.configFile(), parent.files());
    Optional<Setting> setting =
        path.find(session.root())
            .map(container -> ConfigEditor.findPropertyOrCommented(container, path.key()))
            .flatMap(PropertyLookup::current);
    if (setting.isEmpty()) {
      System.err.println("No setting at " + path);
      return 1;
    }
    Setting s = setting.get();
    System.out.println(s.value().text() + "\t" + (s.isEnabled() ? "enabled" : "disabled"));
    return 0;
  }
}
