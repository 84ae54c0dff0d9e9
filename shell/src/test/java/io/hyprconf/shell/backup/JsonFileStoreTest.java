package io.hyprconf.shell.backup;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileStoreTest {
  @TempDir Path dir;

  @AfterEach
  void clearProperty() {
    System.clearProperty(JsonFileStore.STATE_DIR_PROPERTY);
  }

  @Test
  void valuesSurviveNewInstance() {
    Path file = dir.resolve("state/state.json");
    new JsonFileStore(file).set("/etc/a.conf", "backup", "{\"x\":1}");

    JsonFileStore reopened = new JsonFileStore(file);
    assertEquals(Optional.of("{\"x\":1}"), reopened.get("/etc/a.conf", "backup"));
    assertEquals(Optional.empty(), reopened.get("/etc/a.conf", "other"));
    assertEquals(Optional.empty(), reopened.get("/etc/b.conf", "backup"));
  }

  @Test
  void filesAreKeptApart() {
    JsonFileStore store = new JsonFileStore(dir.resolve("state.json"));
    store.set("a", "k", "1");
    store.set("b", "k", "2");
    store.clear("a", "k");

    assertEquals(Optional.empty(), store.get("a", "k"));
    assertEquals(Optional.of("2"), store.get("b", "k"));
  }

  @Test
  void clearingUnknownKeyDoesNotCreateFile() {
    JsonFileStore store = new JsonFileStore(dir.resolve("state.json"));
    store.clear("a", "k");
    assertFalse(Files.exists(store.file()));
  }

  @Test
  void corruptFileReadsAsEmpty() throws IOException {
    Path file = dir.resolve("state.json");
    Files.writeString(file, "{ not json");
    JsonFileStore store = new JsonFileStore(file);

    assertEquals(Optional.empty(), store.get("a", "k"));
    store.set("a", "k", "v");
    assertEquals(Optional.of("v"), new JsonFileStore(file).get("a", "k"));
  }

  @Test
  void stateDirectoryFromSystemProperty() {
    System.setProperty(JsonFileStore.STATE_DIR_PROPERTY, dir.toString());
    assertEquals(dir, JsonFileStore.resolveStateDirectory());
    assertEquals(dir.resolve("state.json"), JsonFileStore.atDefaultLocation().file());
  }

  @Test
  void stateDirectoryDefaultsUnderHome() {
    System.clearProperty(JsonFileStore.STATE_DIR_PROPERTY);
    if (System.getenv(JsonFileStore.STATE_DIR_ENV) == null) {
      assertEquals(
          Paths.get(System.getProperty("user.home"), ".hyprconf"),
          JsonFileStore.resolveStateDirectory());
    }
  }
}
