package io.hyprconf.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.hyprconf.parser.api.ConfigEditor;
import io.hyprconf.parser.api.ConfigParseException;
import io.hyprconf.parser.api.ConfigTree.Block;
import io.hyprconf.parser.api.ConfigTree.Root;
import io.hyprconf.parser.api.ConfigValue;
import io.hyprconf.parser.api.PropertyLookup;
import java.util.List;
import org.junit.jupiter.api.Test;

class HyprConfTest {

  @Test
  void reenablesCommentedSettingWithoutTouchingOtherLines() {
    Root root = HyprConf.parse("input {\n  sensitivity = 0.5\n  # repeat_rate = 40\n}\n");
    Block input = ConfigEditor.findBlock(root, "input").orElseThrow();

    PropertyLookup lookup = ConfigEditor.findPropertyOrCommented(input, "repeat_rate");
    assertTrue(lookup.isCommented());
    assertEquals(new ConfigValue.NumberValue("40", 40), lookup.commented().value());

    ConfigEditor.setPropertyEnabled(input, "repeat_rate", true);
    assertEquals(
        "input {\n  sensitivity = 0.5\n  repeat_rate = 40\n}\n", HyprConf.serialize(root, true));
  }

  @Test
  void editsDeepSettingAndKeepsComments() {
    String text =
        "# managed by hand\n"
            + "input {\n"
            + "  kb_layout = us # primary\n"
            + "  touchpad {\n"
            + "    # natural_scroll = false\n"
            + "    scroll_factor = 1.0\n"
            + "  }\n"
            + "}\n";
    Root root = HyprConf.parse(text);
    Block touchpad = ConfigEditor.ensureBlockPath(root, List.of("input", "touchpad"));
    ConfigEditor.setPropertyEnabled(touchpad, "natural_scroll", true, ConfigValue.of(true));
    ConfigEditor.setPropertyEnabled(touchpad, "scroll_factor", false);

    assertEquals(
        "# managed by hand\n"
            + "input {\n"
            + "  kb_layout = us # primary\n"
            + "  touchpad {\n"
            + "    natural_scroll = true\n"
            + "    # scroll_factor = 1.0\n"
            + "  }\n"
            + "}\n",
        HyprConf.serialize(root));
  }

  @Test
  void reportsUnclosedBlock() {
    ConfigParseException ex =
        assertThrows(ConfigParseException.class, () -> HyprConf.parse("foo {\n  x = 1\n"));
    assertEquals(ConfigParseException.Kind.UNCLOSED_BLOCK, ex.kind());
    assertEquals("EOF", ex.tokenType());
  }

  @Test
  void rejectsNullArguments() {
    assertThrows(NullPointerException.class, () -> HyprConf.parse(null));
    assertThrows(NullPointerException.class, () -> HyprConf.serialize(null, true));
  }
}
