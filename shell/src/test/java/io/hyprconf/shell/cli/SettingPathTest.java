package io.hyprconf.shell.cli;

import static org.junit.jupiter.api.Assertions.*;

import io.hyprconf.parser.HyprConf;
import io.hyprconf.parser.api.ConfigTree.Block;
import io.hyprconf.parser.api.ConfigTree.Container;
import io.hyprconf.parser.api.ConfigTree.Root;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import picocli.CommandLine;

class SettingPathTest {

  @Test
  void splitsBlocksAndKey() {
    SettingPath path = SettingPath.parse("input/touchpad/natural_scroll");
    assertEquals(List.of("input", "touchpad"), path.blocks());
    assertEquals("natural_scroll", path.key());
    assertEquals("input/touchpad/natural_scroll", path.toString());
  }

  @Test
  void bareKeyIsTopLevel() {
    SettingPath path = SettingPath.parse("monitor");
    assertEquals(List.of(), path.blocks());
    Root root = HyprConf.parse("monitor = ,preferred,auto,1\n");
    assertSame(root, path.find(root).orElseThrow());
    assertSame(root, path.ensure(root));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "/a", "a/", "a//b", "a/ b"})
  void rejectsMalformed(String text) {
    assertThrows(IllegalArgumentException.class, () -> SettingPath.parse(text));
    assertThrows(
        CommandLine.TypeConversionException.class, () -> new SettingPath.Converter().convert(text));
  }

  @Test
  void findDoesNotCreateButEnsureDoes() {
    Root root = HyprConf.parse("input {\n}\n");
    SettingPath path = SettingPath.parse("input/touchpad/tap-to-click");

    assertTrue(path.find(root).isEmpty());
    Container touchpad = path.ensure(root);
    assertEquals("touchpad", ((Block) touchpad).name());
    assertSame(touchpad, path.find(root).orElseThrow());
    assertEquals("input {\n  touchpad {\n  }\n}\n", HyprConf.serialize(root));
  }
}
