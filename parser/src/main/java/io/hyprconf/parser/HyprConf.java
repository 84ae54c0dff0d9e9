package io.hyprconf.parser;

import io.hyprconf.parser.api.ConfigParseException;
import io.hyprconf.parser.api.ConfigTree.Root;
import io.hyprconf.parser.impl.ConfigParser;
import io.hyprconf.parser.impl.ConfigSerializer;
import java.util.Objects;

/**
 * Entry point for reading and writing Hyprland-style config text.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Root root = HyprConf.parse(text);
 * ConfigEditor.findBlock(root, "input")
 *     .ifPresent(input -> ConfigEditor.setPropertyEnabled(input, "repeat_rate", true));
 * String updated = HyprConf.serialize(root, true);
 * }</pre>
 *
 * <p>Parsing and serializing work purely in memory. Each {@link #parse(String)} call returns an
 * independent tree; a tree must not be mutated from several threads without external locking.
 */
public final class HyprConf {
  private HyprConf() {}

  /**
   * Parses complete config text.
   *
   * @throws ConfigParseException for a property without {@code =} or an unclosed block
   */
  public static Root parse(String text) {
    Objects.requireNonNull(text, "text");
    return ConfigParser.parse(text);
  }

  /**
   * Renders a tree.
   *
   * @param preserveComments when false, comment lines and inline comments are dropped;
   *     commented-out properties are always kept
   */
  public static String serialize(Root root, boolean preserveComments) {
    Objects.requireNonNull(root, "root");
    return ConfigSerializer.serialize(root, preserveComments);
  }

  public static String serialize(Root root) {
    return serialize(root, true);
  }
}
