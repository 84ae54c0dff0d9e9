package io.hyprconf.shell.cli;

import picocli.CommandLine;

/** Options shared by commands that rewrite the config file. */
final class WriteOptions {
  @CommandLine.Option(
      names = "--backup",
      description = "Copy the file to <file>.backup.<millis> before writing")
  boolean backup;

  @CommandLine.Option(names = "--reload", description = "Run 'hyprctl reload' after writing")
  boolean reload;
}
