package io.hyprconf.shell.backup;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remembers the original content of edited config files together with the state of individual
 * properties, so edits can be listed, summarized and undone.
 *
 * <p>Everything is persisted per file through a {@link KeyValueStore}. A stored entry that cannot
 * be read is logged and treated as absent, and a failed write is logged and otherwise ignored, so
 * bookkeeping problems never block an edit.
 */
public final class ConfigBackupManager {
  private static final Logger log = LoggerFactory.getLogger(ConfigBackupManager.class);

  static final String STATE_KEY = "backup";

  private final KeyValueStore store;
  private final Clock clock;
  private final Gson gson = new GsonBuilder().create();
  private final Map<String, FileState> files = new HashMap<>();

  public ConfigBackupManager(KeyValueStore store) {
    this(store, Clock.systemUTC());
  }

  public ConfigBackupManager(KeyValueStore store, Clock clock) {
    this.store = Objects.requireNonNull(store);
    this.clock = Objects.requireNonNull(clock);
  }

  /** Records {@code content} as the original of {@code filePath}, discarding its change log. */
  public void createBackup(String filePath, String content) {
    FileState state = stateFor(filePath);
    state.originalContent = content;
    state.timestamp = clock.millis();
    state.changes = new ArrayList<>();
    persist(filePath, state);
  }

  /** Appends to the change log; ignored when {@code filePath} has no backup. */
  public void trackChange(
      String filePath,
      String property,
      String oldValue,
      String newValue,
      boolean wasCommented,
      boolean isCommented) {
    FileState state = peek(filePath);
    if (state == null || state.originalContent == null) {
      return;
    }
    state.changes.add(
        new ConfigChange(property, oldValue, newValue, wasCommented, isCommented, clock.millis()));
    persist(filePath, state);
  }

  /**
   * Sets the current state of a property. The first call for a property also fixes its original
   * state.
   */
  public void setPropertyState(String filePath, String property, String value, boolean enabled) {
    FileState state = stateFor(filePath);
    PropertyState existing = state.properties.get(property);
    state.properties.put(
        property,
        existing == null
            ? PropertyState.initial(value, enabled)
            : existing.withCurrent(value, enabled));
    persist(filePath, state);
  }

  /** Like {@link #setPropertyState} but logs the change; ignored for untracked properties. */
  public void updatePropertyState(String filePath, String property, String value, boolean enabled) {
    FileState state = peek(filePath);
    PropertyState existing = state == null ? null : state.properties.get(property);
    if (existing == null) {
      return;
    }
    trackChange(filePath, property, existing.value(), value, !existing.enabled(), !enabled);
    state.properties.put(property, existing.withCurrent(value, enabled));
    persist(filePath, state);
  }

  public Optional<PropertyState> getPropertyState(String filePath, String property) {
    FileState state = peek(filePath);
    return state == null ? Optional.empty() : Optional.ofNullable(state.properties.get(property));
  }

  public boolean isPropertyModified(String filePath, String property) {
    return getPropertyState(filePath, property).map(PropertyState::isModified).orElse(false);
  }

  /** The state to restore {@code property} to. The caller applies it. */
  public Optional<PropertyState> restoreProperty(String filePath, String property) {
    return getPropertyState(filePath, property).map(PropertyState::original);
  }

  /** The original content recorded by {@link #createBackup}. */
  public Optional<String> restoreFile(String filePath) {
    FileState state = peek(filePath);
    return state == null ? Optional.empty() : Optional.ofNullable(state.originalContent);
  }

  public List<ConfigChange> getChanges(String filePath) {
    FileState state = peek(filePath);
    return state == null || state.originalContent == null
        ? List.of()
        : List.copyOf(state.changes);
  }

  public void clearBackup(String filePath) {
    files.remove(filePath);
    try {
      store.clear(filePath, STATE_KEY);
    } catch (UncheckedIOException e) {
      log.warn("Failed to clear backup state for {}: {}", filePath, e.getMessage());
    }
  }

  public List<String> getModifiedProperties(String filePath) {
    FileState state = peek(filePath);
    if (state == null) {
      return List.of();
    }
    List<String> modified = new ArrayList<>();
    state.properties.forEach(
        (property, propertyState) -> {
          if (propertyState.isModified()) {
            modified.add(property);
          }
        });
    return modified;
  }

  public ChangeSummary getChangeSummary(String filePath) {
    FileState state = peek(filePath);
    if (state == null) {
      return ChangeSummary.EMPTY;
    }
    int modified = 0;
    int enabled = 0;
    int disabled = 0;
    for (PropertyState propertyState : state.properties.values()) {
      if (!propertyState.isModified()) {
        continue;
      }
      modified++;
      if (propertyState.enabled() && !propertyState.originallyEnabled()) {
        enabled++;
      } else if (!propertyState.enabled() && propertyState.originallyEnabled()) {
        disabled++;
      }
    }
    return new ChangeSummary(modified, enabled, disabled);
  }

  private FileState stateFor(String filePath) {
    FileState state = peek(filePath);
    if (state == null) {
      state = new FileState();
      files.put(filePath, state);
    }
    return state;
  }

  private FileState peek(String filePath) {
    FileState cached = files.get(filePath);
    if (cached != null) {
      return cached;
    }
    FileState loaded = load(filePath);
    if (loaded != null) {
      files.put(filePath, loaded);
    }
    return loaded;
  }

  private FileState load(String filePath) {
    Optional<String> json;
    try {
      json = store.get(filePath, STATE_KEY);
    } catch (UncheckedIOException e) {
      log.warn("Failed to load backup state for {}: {}", filePath, e.getMessage());
      return null;
    }
    if (json.isEmpty()) {
      return null;
    }
    try {
      FileState state = gson.fromJson(json.get(), FileState.class);
      if (state == null) {
        return null;
      }
      if (state.changes == null) {
        state.changes = new ArrayList<>();
      }
      if (state.properties == null) {
        state.properties = new LinkedHashMap<>();
      }
      return state;
    } catch (JsonParseException e) {
      log.warn("Ignoring corrupt backup state for {}: {}", filePath, e.getMessage());
      return null;
    }
  }

  private void persist(String filePath, FileState state) {
    try {
      store.set(filePath, STATE_KEY, gson.toJson(state));
    } catch (UncheckedIOException e) {
      log.warn("Failed to save backup state for {}: {}", filePath, e.getMessage());
    }
  }

  private static final class FileState {
    String originalContent;
    long timestamp;
    List<ConfigChange> changes = new ArrayList<>();
    Map<String, PropertyState> properties = new LinkedHashMap<>();
  }
}
