package io.hyprconf.shell.cli;

import io.hyprconf.shell.ConfigSession;
import io.hyprconf.shell.Main;
import java.io.IOException;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "format",
    description = "Print the file in normalized form",
    mixinStandardHelpOptions = true)
public final class FormatCommand implements Callable<Integer> {

  @CommandLine.ParentCommand Main parent;

  @CommandLine.Option(
      names = "--strip-comments",
      description = "Drop comment lines and inline comments")
  boolean stripComments;

  @CommandLine.Option(names = "--write", description = "Rewrite the file instead of printing it")
  boolean write;

  @CommandLine.Mixin WriteOptions writeOptions = new WriteOptions();

  @Override
  public Integer call() throws IOException {
    ConfigSession session = ConfigSession.open(parent.configFile(), parent.files());
    String text = session.text(!stripComments);
    if (!write) {
      System.out.print(text);
      return 0;
    }
    if (text.equals(session.originalText())) {
      return 0;
    }
    session
        .save(text, writeOptions.backup, writeOptions.reload ? parent.reloader() : null)
        .ifPresent(backup -> System.err.println("Backup written to " + backup));
    return 0;
  }
}
