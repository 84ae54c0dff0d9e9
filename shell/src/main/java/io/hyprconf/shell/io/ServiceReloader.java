package io.hyprconf.shell.io;

import java.io.IOException;

/** Tells the running compositor to pick up configuration changes. */
public interface ServiceReloader {
  void reload() throws IOException;
}
