package io.hyprconf.shell;

import io.hyprconf.parser.api.ConfigParseException;
import io.hyprconf.shell.backup.ConfigBackupManager;
import io.hyprconf.shell.backup.JsonFileStore;
import io.hyprconf.shell.cli.CheckCommand;
import io.hyprconf.shell.cli.DisableCommand;
import io.hyprconf.shell.cli.EnableCommand;
import io.hyprconf.shell.cli.FormatCommand;
import io.hyprconf.shell.cli.GetCommand;
import io.hyprconf.shell.cli.SetCommand;
import io.hyprconf.shell.io.ConfigFiles;
import io.hyprconf.shell.io.HyprctlReloader;
import io.hyprconf.shell.io.ServiceReloader;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "hyprconf",
    description = "Query and edit Hyprland configuration files",
    version = "0.1.0",
    mixinStandardHelpOptions = true,
    subcommands = {
      GetCommand.class,
      SetCommand.class,
      EnableCommand.class,
      DisableCommand.class,
      FormatCommand.class,
      CheckCommand.class
    })
public final class Main implements Callable<Integer> {
  static final String FILE_PROPERTY = "hyprconf.file";
  static final String FILE_ENV = "HYPRCONF_FILE";

  @CommandLine.Option(
      names = {"-f", "--file"},
      description = "Config file (default: $HYPRCONF_FILE or ~/.config/hypr/hyprland.conf)")
  private Path file;

  private final ConfigFiles files;
  private final ServiceReloader reloader;
  private final ConfigBackupManager backups;

  public Main() {
    this(
        new ConfigFiles(),
        new HyprctlReloader(),
        new ConfigBackupManager(JsonFileStore.atDefaultLocation()));
  }

  Main(ConfigFiles files, ServiceReloader reloader, ConfigBackupManager backups) {
    this.files = files;
    this.reloader = reloader;
    this.backups = backups;
  }

  public static void main(String[] args) {
    int exitCode = commandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  static CommandLine commandLine(Main main) {
    return new CommandLine(main).setExecutionExceptionHandler(Main::handleError);
  }

  private static int handleError(
      Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult) throws Exception {
    if (e instanceof ConfigParseException) {
      System.err.println("Error: " + e.getMessage());
      return 2;
    }
    if (e instanceof IOException || e instanceof IllegalArgumentException) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
    throw e;
  }

  @Override
  public Integer call() {
    CommandLine.usage(this, System.out);
    return 0;
  }

  /**
   * The file to operate on, from (in order): the {@code -f} option, the {@code hyprconf.file}
   * system property, the {@code HYPRCONF_FILE} environment variable, or {@code
   * ~/.config/hypr/hyprland.conf}.
   */
  public Path configFile() {
    if (file != null) {
      return file;
    }
    String sysProp = System.getProperty(FILE_PROPERTY);
    if (sysProp != null && !sysProp.isBlank()) {
      return Paths.get(sysProp);
    }
    String envVar = System.getenv(FILE_ENV);
    if (envVar != null && !envVar.isBlank()) {
      return Paths.get(envVar);
    }
    return Paths.get(System.getProperty("user.home"), ".config", "hypr", "hyprland.conf");
  }

  public ConfigFiles files() {
    return files;
  }

  public ServiceReloader reloader() {
    return reloader;
  }

  /** Original content and per-setting change history, keyed by absolute config path. */
  public ConfigBackupManager backups() {
    return backups;
  }
}
