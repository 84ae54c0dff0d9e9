package io.hyprconf.parser.api;

import io.hyprconf.parser.api.ConfigTree.CommentedProperty;
import io.hyprconf.parser.api.ConfigTree.Property;
import io.hyprconf.parser.api.ConfigTree.Setting;
import java.util.Optional;

/**
 * Result of looking a key up as both an active and a commented property.
 *
 * @param property first active match, or null
 * @param commented first commented match, or null
 * @param isCommented true only when a commented match exists and no active one does
 */
public record PropertyLookup(Property property, CommentedProperty commented, boolean isCommented) {

  static PropertyLookup of(Property property, CommentedProperty commented) {
    return new PropertyLookup(property, commented, commented != null && property == null);
  }

  /** The entry that represents the key's current state; the active one wins. */
  public Optional<Setting> current() {
    if (property != null) return Optional.of(property);
    return Optional.ofNullable(commented);
  }

  public boolean isPresent() {
    return property != null || commented != null;
  }
}
