package io.hyprconf.shell.cli;

import io.hyprconf.parser.api.ConfigParseException;
import io.hyprconf.shell.ConfigSession;
import io.hyprconf.shell.Main;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "check",
    description = "Parse the file and report the first syntax error",
    mixinStandardHelpOptions = true)
public final class CheckCommand implements Callable<Integer> {

  @CommandLine.ParentCommand Main parent;

  @Override
  public Integer call() throws IOException {
    Path file = parent.configFile();
    try {
      ConfigSession.open(file, parent.files());
    } catch (ConfigParseException e) {
      System.err.println(file + ":" + e.line() + ":" + e.column() + ": " + e.getMessage());
      return 2;
    }
    System.out.println(file + ": OK");
    return 0;
  }
}
