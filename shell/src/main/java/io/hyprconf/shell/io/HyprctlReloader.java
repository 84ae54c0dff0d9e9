package io.hyprconf.shell.io;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@code hyprctl reload}.
 *
 * <p>Output is drained on a separate thread so that a command which never exits is still cut off
 * by the timeout.
 */
public final class HyprctlReloader implements ServiceReloader {
  private static final Logger log = LoggerFactory.getLogger(HyprctlReloader.class);

  private static final Duration TIMEOUT = Duration.ofSeconds(10);
  private static final long DRAIN_JOIN_MILLIS = 500;

  private final List<String> command;
  private final Duration timeout;

  public HyprctlReloader() {
    this(List.of("hyprctl", "reload"));
  }

  HyprctlReloader(List<String> command) {
    this(command, TIMEOUT);
  }

  HyprctlReloader(List<String> command, Duration timeout) {
    this.command = List.copyOf(command);
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public void reload() throws IOException {
    String commandLine = String.join(" ", command);
    Process process;
    try {
      process = new ProcessBuilder(command).redirectErrorStream(true).start();
    } catch (IOException e) {
      throw new IOException("Failed to run " + commandLine + ": " + e.getMessage(), e);
    }
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    Thread drain = new Thread(() -> drain(process, buffer), "hyprctl-output");
    drain.setDaemon(true);
    drain.start();
    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new IOException(commandLine + " timed out after " + timeout.toSeconds() + "s");
      }
      drain.join(DRAIN_JOIN_MILLIS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new InterruptedIOException("Interrupted while waiting for " + command.get(0));
    }
    if (process.exitValue() != 0) {
      String output = buffer.toString(StandardCharsets.UTF_8).trim();
      throw new IOException(
          commandLine
              + " exited with "
              + process.exitValue()
              + (output.isEmpty() ? "" : ": " + output));
    }
    log.info("Reloaded configuration via {}", commandLine);
  }

  private static void drain(Process process, ByteArrayOutputStream buffer) {
    byte[] chunk = new byte[1024];
    try (InputStream in = process.getInputStream()) {
      int n;
      while ((n = in.read(chunk)) != -1) {
        buffer.write(chunk, 0, n);
      }
    } catch (IOException e) {
      // the stream closes under us when the process is destroyed
      log.debug("Stopped reading reload output: {}", e.getMessage());
    }
  }
}
