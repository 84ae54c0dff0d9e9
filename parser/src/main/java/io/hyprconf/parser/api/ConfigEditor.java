package io.hyprconf.parser.api;

import io.hyprconf.parser.api.ConfigTree.Block;
import io.hyprconf.parser.api.ConfigTree.CommentedProperty;
import io.hyprconf.parser.api.ConfigTree.Container;
import io.hyprconf.parser.api.ConfigTree.Node;
import io.hyprconf.parser.api.ConfigTree.Property;
import io.hyprconf.parser.api.ConfigTree.Setting;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structural lookups and in-place edits over a config tree.
 *
 * <p>Enabling or disabling a setting replaces the node at its current index among its siblings;
 * nodes are never removed and re-appended, so an edit cannot reorder the file. New nodes are only
 * ever appended when nothing matches. None of the operations fail on missing entries: they either
 * act or do nothing.
 */
public final class ConfigEditor {
  private ConfigEditor() {}

  /** First direct child block of {@code container} with the given name. */
  public static Optional<Block> findBlock(Container container, String name) {
    for (Node node : container.children()) {
      if (node instanceof Block b && b.name().equals(name)) return Optional.of(b);
    }
    return Optional.empty();
  }

  /** Walks nested blocks, e.g. {@code ["input", "touchpad"]}. An empty path is not a block. */
  public static Optional<Block> findBlockPath(Container container, List<String> names) {
    if (names.isEmpty()) return Optional.empty();
    Container cur = container;
    Block found = null;
    for (String name : names) {
      Optional<Block> next = findBlock(cur, name);
      if (next.isEmpty()) return Optional.empty();
      found = next.get();
      cur = found;
    }
    return Optional.of(found);
  }

  /** Returns the named child block, creating and appending an empty one when absent. */
  public static Block ensureBlock(Container container, String name) {
    Objects.requireNonNull(name, "name");
    Optional<Block> existing = findBlock(container, name);
    if (existing.isPresent()) return existing.get();
    Block created = new Block(name);
    container.children().add(created);
    return created;
  }

  public static Block ensureBlockPath(Container container, List<String> names) {
    if (names.isEmpty()) throw new IllegalArgumentException("Empty block path");
    Container cur = container;
    Block block = null;
    for (String name : names) {
      block = ensureBlock(cur, name);
      cur = block;
    }
    return block;
  }

  public static Optional<Property> findProperty(Container container, String key) {
    for (Node node : container.children()) {
      if (node instanceof Property p && p.key().equals(key)) return Optional.of(p);
    }
    return Optional.empty();
  }

  public static Optional<CommentedProperty> findCommentedProperty(Container container, String key) {
    for (Node node : container.children()) {
      if (node instanceof CommentedProperty p && p.key().equals(key)) return Optional.of(p);
    }
    return Optional.empty();
  }

  public static PropertyLookup findPropertyOrCommented(Container container, String key) {
    return PropertyLookup.of(
        findProperty(container, key).orElse(null),
        findCommentedProperty(container, key).orElse(null));
  }

  /**
   * Moves {@code key} to the requested state.
   *
   * <table>
   *   <caption>Transitions</caption>
   *   <tr><th>current</th><th>enabled</th><th>effect</th></tr>
   *   <tr><td>commented only</td><td>true</td>
   *       <td>converted in place, with {@code value} or the remembered value</td></tr>
   *   <tr><td>none</td><td>true</td><td>appended when {@code value} is given</td></tr>
   *   <tr><td>active</td><td>true</td><td>value replaced in place when given</td></tr>
   *   <tr><td>active</td><td>false</td><td>converted to commented in place</td></tr>
   *   <tr><td>commented only or none</td><td>false</td><td>nothing</td></tr>
   * </table>
   *
   * @param value new value, or null to keep the current or remembered one
   */
  public static void setPropertyEnabled(
      Container container, String key, boolean enabled, ConfigValue value) {
    PropertyLookup lookup = findPropertyOrCommented(container, key);
    if (enabled) {
      if (lookup.property() != null) {
        if (value != null) lookup.property().setValue(value);
      } else if (lookup.commented() != null) {
        setSettingEnabled(container, lookup.commented(), true, value);
      } else if (value != null) {
        container.children().add(new Property(key, value));
      }
    } else if (lookup.property() != null) {
      setSettingEnabled(container, lookup.property(), false, null);
    }
  }

  public static void setPropertyEnabled(Container container, String key, boolean enabled) {
    setPropertyEnabled(container, key, enabled, null);
  }

  /**
   * Same transition as {@link #setPropertyEnabled} for one specific child, which matters when a key
   * repeats (several {@code monitor} lines, say). A value given while disabling becomes the
   * remembered value.
   *
   * @return the node now at the setting's index
   * @throws IllegalArgumentException if {@code setting} is not a direct child of {@code container}
   */
  public static Setting setSettingEnabled(
      Container container, Setting setting, boolean enabled, ConfigValue value) {
    int index = indexOf(container, setting);
    if (index < 0) {
      throw new IllegalArgumentException("Not a child of this container: " + setting);
    }
    Setting result;
    if (enabled == setting.isEnabled()) {
      result = setting;
    } else if (setting instanceof Property p) {
      result = p.disable();
    } else {
      result = ((CommentedProperty) setting).enable(null);
    }
    if (value != null) result.setValue(value);
    if (result != setting) container.children().set(index, result);
    return result;
  }

  /** Replaces the value of the active {@code key} or appends a new property. */
  public static Property updateOrAddProperty(Container container, String key, ConfigValue value) {
    Objects.requireNonNull(value, "value");
    Optional<Property> existing = findProperty(container, key);
    if (existing.isPresent()) {
      existing.get().setValue(value);
      return existing.get();
    }
    Property created = new Property(key, value);
    container.children().add(created);
    return created;
  }

  /**
   * Flips the current state of {@code key}: an active entry is commented out, otherwise a commented
   * one is re-enabled (with {@code value} when given). With neither present and a value given, a
   * new active property is appended.
   */
  public static void togglePropertyComment(Container container, String key, ConfigValue value) {
    PropertyLookup lookup = findPropertyOrCommented(container, key);
    if (lookup.property() != null) {
      setSettingEnabled(container, lookup.property(), false, null);
    } else if (lookup.commented() != null) {
      setSettingEnabled(container, lookup.commented(), true, value);
    } else if (value != null) {
      container.children().add(new Property(key, value));
    }
  }

  /** Identity index of {@code node} among the container's children, or -1. */
  public static int indexOf(Container container, Node node) {
    List<Node> children = container.children();
    for (int i = 0; i < children.size(); i++) {
      if (children.get(i) == node) return i;
    }
    return -1;
  }
}
