package io.hyprconf.shell.backup;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link KeyValueStore} kept in a single JSON document of the form {@code {file: {key: value}}}.
 *
 * <p>The default location is {@code state.json} inside the directory named by the {@code
 * hyprconf.state.dir} system property, the {@code HYPRCONF_STATE_DIR} environment variable, or
 * {@code ~/.hyprconf}, checked in that order.
 */
public final class JsonFileStore implements KeyValueStore {
  private static final Logger log = LoggerFactory.getLogger(JsonFileStore.class);

  static final String STATE_DIR_PROPERTY = "hyprconf.state.dir";
  static final String STATE_DIR_ENV = "HYPRCONF_STATE_DIR";
  private static final String DEFAULT_DIR = ".hyprconf";
  private static final String STATE_JSON = "state.json";

  private final Path file;
  private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

  public JsonFileStore(Path file) {
    this.file = file;
  }

  public static JsonFileStore atDefaultLocation() {
    return new JsonFileStore(resolveStateDirectory().resolve(STATE_JSON));
  }

  static Path resolveStateDirectory() {
    String sysProp = System.getProperty(STATE_DIR_PROPERTY);
    if (sysProp != null && !sysProp.isBlank()) {
      return Paths.get(sysProp);
    }
    String envVar = System.getenv(STATE_DIR_ENV);
    if (envVar != null && !envVar.isBlank()) {
      return Paths.get(envVar);
    }
    return Paths.get(System.getProperty("user.home"), DEFAULT_DIR);
  }

  Path file() {
    return file;
  }

  @Override
  public synchronized Optional<String> get(String configFile, String key) {
    JsonObject entries = load().getAsJsonObject(configFile);
    if (entries == null) {
      return Optional.empty();
    }
    JsonElement value = entries.get(key);
    return value == null || !value.isJsonPrimitive()
        ? Optional.empty()
        : Optional.of(value.getAsString());
  }

  @Override
  public synchronized void set(String configFile, String key, String value) {
    JsonObject root = load();
    JsonObject entries = root.getAsJsonObject(configFile);
    if (entries == null) {
      entries = new JsonObject();
      root.add(configFile, entries);
    }
    entries.addProperty(key, value);
    save(root);
  }

  @Override
  public synchronized void clear(String configFile, String key) {
    JsonObject root = load();
    JsonObject entries = root.getAsJsonObject(configFile);
    if (entries == null || entries.remove(key) == null) {
      return;
    }
    if (entries.size() == 0) {
      root.remove(configFile);
    }
    save(root);
  }

  private JsonObject load() {
    if (!Files.exists(file)) {
      return new JsonObject();
    }
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      JsonElement root = JsonParser.parseReader(reader);
      if (root.isJsonObject()) {
        return root.getAsJsonObject();
      }
      log.warn("Ignoring state file {}: not a JSON object", file);
    } catch (JsonParseException e) {
      log.warn("Ignoring unreadable state file {}: {}", file, e.getMessage());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + file, e);
    }
    return new JsonObject();
  }

  private void save(JsonObject root) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
        gson.toJson(root, writer);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write " + file, e);
    }
  }
}
