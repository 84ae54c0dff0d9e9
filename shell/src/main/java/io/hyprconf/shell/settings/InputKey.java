package io.hyprconf.shell.settings;

/** The settings of the {@code input} block handled by {@link InputConfigManager}. */
public enum InputKey {
  KB_LAYOUT(null, "kb_layout"),
  KB_OPTIONS(null, "kb_options"),
  REPEAT_RATE(null, "repeat_rate"),
  REPEAT_DELAY(null, "repeat_delay"),
  SENSITIVITY(null, "sensitivity"),
  NATURAL_SCROLL("touchpad", "natural_scroll"),
  CLICKFINGER_BEHAVIOR("touchpad", "clickfinger_behavior"),
  SCROLL_FACTOR("touchpad", "scroll_factor");

  private final String block;
  private final String key;

  InputKey(String block, String key) {
    this.block = block;
    this.key = key;
  }

  /** Name of the sub-block of {@code input} holding this key, or null for {@code input} itself. */
  public String block() {
    return block;
  }

  public String key() {
    return key;
  }

  /** Name under which the backup manager tracks this key, e.g. {@code touchpad.scroll_factor}. */
  public String trackingName() {
    return block == null ? key : block + "." + key;
  }
}
