package io.hyprconf.shell.cli;

import io.hyprconf.parser.api.ConfigEditor;
import io.hyprconf.parser.api.ConfigTree.Container;
import io.hyprconf.parser.api.ConfigTree.Root;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import picocli.CommandLine;

/** A {@code /}-separated setting address such as {@code input/touchpad/natural_scroll}. */
public record SettingPath(List<String> blocks, String key) {

  public SettingPath {
    blocks = List.copyOf(blocks);
  }

  public static SettingPath parse(String text) {
    List<String> parts = Arrays.asList(text.split("/", -1));
    if (parts.stream().anyMatch(p -> p.isEmpty() || !p.equals(p.strip()))) {
      throw new IllegalArgumentException("Invalid setting path: '" + text + "'");
    }
    return new SettingPath(parts.subList(0, parts.size() - 1), parts.get(parts.size() - 1));
  }

  /** The block holding the key, if every block on the path exists. */
  public Optional<Container> find(Root root) {
    if (blocks.isEmpty()) {
      return Optional.of(root);
    }
    return ConfigEditor.findBlockPath(root, blocks).map(b -> b);
  }

  /** The block holding the key, creating missing blocks. */
  public Container ensure(Root root) {
    return blocks.isEmpty() ? root : ConfigEditor.ensureBlockPath(root, blocks);
  }

  @Override
  public String toString() {
    return blocks.isEmpty() ? key : String.join("/", blocks) + "/" + key;
  }

  static final class Converter implements CommandLine.ITypeConverter<SettingPath> {
    @Override
    public SettingPath convert(String value) {
      try {
        return parse(value);
      } catch (IllegalArgumentException e) {
        throw new CommandLine.TypeConversionException(e.getMessage());
      }
    }
  }
}
