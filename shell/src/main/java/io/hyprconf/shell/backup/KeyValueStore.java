package io.hyprconf.shell.backup;

import java.util.Optional;

/** String values grouped per config file. */
public interface KeyValueStore {
  Optional<String> get(String file, String key);

  void set(String file, String key, String value);

  void clear(String file, String key);
}
