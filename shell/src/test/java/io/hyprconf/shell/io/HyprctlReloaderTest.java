package io.hyprconf.shell.io;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

@EnabledOnOs({OS.LINUX, OS.MAC})
class HyprctlReloaderTest {

  @Test
  void successfulCommand() {
    assertDoesNotThrow(() -> new HyprctlReloader(List.of("sh", "-c", "exit 0")).reload());
  }

  @Test
  void nonZeroExitIncludesOutput() {
    HyprctlReloader reloader =
        new HyprctlReloader(List.of("sh", "-c", "echo 'no instance running'; exit 3"));
    IOException e = assertThrows(IOException.class, reloader::reload);
    assertTrue(e.getMessage().contains("exited with 3"), e.getMessage());
    assertTrue(e.getMessage().contains("no instance running"), e.getMessage());
  }

  @Test
  void missingExecutable() {
    HyprctlReloader reloader = new HyprctlReloader(List.of("hyprconf-no-such-binary", "reload"));
    IOException e = assertThrows(IOException.class, reloader::reload);
    assertTrue(e.getMessage().startsWith("Failed to run hyprconf-no-such-binary reload"));
  }

  @Test
  void hangingCommandIsKilledAfterTimeout() {
    HyprctlReloader reloader =
        new HyprctlReloader(List.of("sh", "-c", "sleep 30"), Duration.ofSeconds(1));
    IOException e =
        assertTimeoutPreemptively(
            Duration.ofSeconds(12), () -> assertThrows(IOException.class, reloader::reload));
    assertTrue(e.getMessage().contains("timed out"), e.getMessage());
  }

  @Test
  void chattyCommandDoesNotBlockOnFullPipe() {
    // more output than a pipe buffer holds
    HyprctlReloader reloader =
        new HyprctlReloader(
            List.of("sh", "-c", "head -c 262144 /dev/zero | tr '\\0' x; exit 4"),
            Duration.ofSeconds(5));
    IOException e = assertThrows(IOException.class, reloader::reload);
    assertTrue(e.getMessage().contains("exited with 4"), e.getMessage());
  }
}
