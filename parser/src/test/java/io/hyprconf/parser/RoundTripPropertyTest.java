package io.hyprconf.parser;

import static io.hyprconf.parser.api.ConfigTree.UNPOSITIONED;
import static org.junit.jupiter.api.Assertions.*;

import io.hyprconf.parser.api.ConfigEditor;
import io.hyprconf.parser.api.ConfigTree;
import io.hyprconf.parser.api.ConfigTree.Block;
import io.hyprconf.parser.api.ConfigTree.Comment;
import io.hyprconf.parser.api.ConfigTree.Container;
import io.hyprconf.parser.api.ConfigTree.Node;
import io.hyprconf.parser.api.ConfigTree.Root;
import io.hyprconf.parser.api.ConfigTree.Setting;
import io.hyprconf.parser.api.ConfigValue;
import io.hyprconf.parser.api.PropertyLookup;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.jqwik.api.*;

/**
 * Property-based checks of the parse/serialize/edit contract over generated config trees.
 *
 * <p>Generated trees are first normalized through one serialize/parse cycle, so every check runs
 * against a tree the parser actually produced.
 */
@PropertyDefaults(tries = 300)
class RoundTripPropertyTest {

  @Property
  void serializeThenParseIsFixedPoint(@ForAll("trees") Root generated) {
    Root parsed = HyprConf.parse(HyprConf.serialize(generated, true));
    String text = HyprConf.serialize(parsed, true);
    Root reparsed = HyprConf.parse(text);
    assertTrue(ConfigTree.structurallyEqual(parsed, reparsed), text);
    assertEquals(text, HyprConf.serialize(reparsed, true));
  }

  @Property
  void strippingCommentsKeepsEverySetting(@ForAll("trees") Root generated) {
    Root parsed = HyprConf.parse(HyprConf.serialize(generated, true));
    Root stripped = HyprConf.parse(HyprConf.serialize(parsed, false));
    assertEquals(count(parsed, Setting.class), count(stripped, Setting.class));
    assertEquals(count(parsed, Block.class), count(stripped, Block.class));
    assertEquals(0, count(stripped, Comment.class));
  }

  @Property
  void togglingNeverMovesSiblings(@ForAll("trees") Root generated) {
    Root parsed = HyprConf.parse(HyprConf.serialize(generated, true));
    for (Container container : containers(parsed)) {
      for (String key : keys(container)) {
        List<Node> before = new ArrayList<>(container.children());
        PropertyLookup lookup = ConfigEditor.findPropertyOrCommented(container, key);
        Setting target = lookup.current().orElseThrow();
        int index = ConfigEditor.indexOf(container, target);

        ConfigEditor.setPropertyEnabled(container, key, lookup.isCommented());

        List<Node> after = container.children();
        assertEquals(before.size(), after.size());
        for (int i = 0; i < before.size(); i++) {
          if (i != index) assertSame(before.get(i), after.get(i), "moved sibling at " + i);
        }
        Setting toggled = (Setting) after.get(index);
        assertEquals(key, toggled.key());
        assertEquals(target.value(), toggled.value());
        assertEquals(target.line(), toggled.line());
        assertNotEquals(target.isEnabled(), toggled.isEnabled());
      }
    }
  }

  @Property
  void activeEntryWins(
      @ForAll("keys") String key,
      @ForAll("values") ConfigValue active,
      @ForAll("values") ConfigValue commented,
      @ForAll boolean commentedFirst) {
    Block block = new Block("b");
    ConfigTree.Property p = new ConfigTree.Property(key, active);
    ConfigTree.CommentedProperty cp = new ConfigTree.CommentedProperty(key, commented);
    block.children().add(commentedFirst ? cp : p);
    block.children().add(commentedFirst ? p : cp);

    PropertyLookup lookup = ConfigEditor.findPropertyOrCommented(block, key);
    assertFalse(lookup.isCommented());
    assertSame(p, lookup.current().orElseThrow());
  }

  @Provide
  Arbitrary<Root> trees() {
    return node(3).list().ofMaxSize(6).map(Root::new);
  }

  @Provide
  Arbitrary<String> keys() {
    return Arbitraries.strings()
        .withCharRange('a', 'z')
        .withChars('_')
        .ofMinLength(1)
        .ofMaxLength(10)
        .filter(k -> !k.equals("true") && !k.equals("false"));
  }

  @Provide
  Arbitrary<ConfigValue> values() {
    return Arbitraries.oneOf(
        Arbitraries.of(true, false).map(b -> ConfigValue.of(b.booleanValue())),
        Arbitraries.longs().between(-1000, 100_000).map(l -> ConfigValue.of(l.longValue())),
        Arbitraries.of("0.5", "0.50", "1e3", "0x1F", ".25", "-2").map(ConfigValue::coerce),
        Arbitraries.strings()
            .withChars("abcXYZ019,:-._ =$()")
            .ofMaxLength(16)
            .map(ConfigValue::of),
        Arbitraries.strings().withChars("ab #{}'\"\\=").ofMaxLength(12).map(ConfigValue::of));
  }

  private Arbitrary<String> commentText() {
    return Arbitraries.strings().withChars("abc xyz=#{}\"'12").ofMaxLength(20);
  }

  private Arbitrary<Node> node(int depth) {
    Arbitrary<String> inline = commentText().injectNull(0.6);
    Arbitrary<Node> property =
        Combinators.combine(keys(), values(), inline)
            .as((k, v, c) -> (Node) new ConfigTree.Property(k, v, c, UNPOSITIONED));
    Arbitrary<Node> commented =
        Combinators.combine(keys(), values(), inline)
            .as((k, v, c) -> (Node) new ConfigTree.CommentedProperty(k, v, c, UNPOSITIONED));
    Arbitrary<Node> comment = commentText().map(t -> (Node) new Comment(t, UNPOSITIONED));
    if (depth <= 0) {
      return Arbitraries.oneOf(property, commented, comment);
    }
    Arbitrary<Node> block =
        Combinators.combine(keys(), node(depth - 1).list().ofMaxSize(5))
            .as((name, kids) -> (Node) new Block(name, kids, UNPOSITIONED));
    return Arbitraries.frequencyOf(
        Tuple.of(4, property), Tuple.of(2, commented), Tuple.of(2, comment), Tuple.of(1, block));
  }

  private static List<Container> containers(Root root) {
    List<Container> out = new ArrayList<>();
    collect(root, out);
    return out;
  }

  private static void collect(Container container, List<Container> out) {
    out.add(container);
    for (Node child : container.children()) {
      if (child instanceof Block b) collect(b, out);
    }
  }

  private static long count(Root root, Class<? extends Node> kind) {
    long n = 0;
    for (Container c : containers(root)) {
      n += c.children().stream().filter(kind::isInstance).count();
    }
    return n;
  }

  private static Set<String> keys(Container container) {
    Set<String> keys = new LinkedHashSet<>();
    for (Node child : container.children()) {
      if (child instanceof Setting s) keys.add(s.key());
    }
    return keys;
  }
}
