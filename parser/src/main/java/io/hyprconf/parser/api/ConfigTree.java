package io.hyprconf.parser.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Config tree model.
 *
 * <p>A tree is an ordered {@link Root} of {@link Node}s; {@link Block}s nest arbitrarily. Child
 * order is significant: mutations replace nodes at their existing index and only append or insert
 * when asked to. Trees are mutable and not thread-safe.
 */
public final class ConfigTree {
  private ConfigTree() {}

  /** Line number of nodes created by mutation rather than read from source. */
  public static final int UNPOSITIONED = -1;

  public sealed interface Node permits Comment, Setting, Block {
    /** 1-based source line, or {@link #UNPOSITIONED}. */
    int line();
  }

  /** Anything holding an ordered, mutable list of child nodes. */
  public sealed interface Container permits Block, Root {
    List<Node> children();
  }

  public static final class Comment implements Node {
    private final String content;
    private final int line;

    public Comment(String content, int line) {
      this.content = Objects.requireNonNull(content, "content");
      this.line = line;
    }

    public String content() {
      return content;
    }

    @Override
    public int line() {
      return line;
    }

    @Override
    public String toString() {
      return "Comment{" + content + "}";
    }
  }

  /** A {@code key = value} line, either active or commented out. */
  public abstract static sealed class Setting implements Node permits Property, CommentedProperty {
    private final String key;
    private ConfigValue value;
    private String comment;
    private final int line;

    Setting(String key, ConfigValue value, String comment, int line) {
      this.key = Objects.requireNonNull(key, "key");
      this.value = Objects.requireNonNull(value, "value");
      this.comment = comment;
      this.line = line;
    }

    public String key() {
      return key;
    }

    public ConfigValue value() {
      return value;
    }

    public void setValue(ConfigValue value) {
      this.value = Objects.requireNonNull(value, "value");
    }

    /** Inline comment text, or null. */
    public String comment() {
      return comment;
    }

    public void setComment(String comment) {
      this.comment = comment;
    }

    @Override
    public int line() {
      return line;
    }

    public abstract boolean isEnabled();

    @Override
    public String toString() {
      return getClass().getSimpleName() + "{" + key + "=" + value.render() + "}";
    }
  }

  public static final class Property extends Setting {
    public Property(String key, ConfigValue value) {
      this(key, value, null, UNPOSITIONED);
    }

    public Property(String key, ConfigValue value, String comment, int line) {
      super(key, value, comment, line);
    }

    @Override
    public boolean isEnabled() {
      return true;
    }

    /** Commented-out copy keeping key, value, inline comment and line. */
    public CommentedProperty disable() {
      return new CommentedProperty(key(), value(), comment(), line());
    }
  }

  public static final class CommentedProperty extends Setting {
    public CommentedProperty(String key, ConfigValue value) {
      this(key, value, null, UNPOSITIONED);
    }

    public CommentedProperty(String key, ConfigValue value, String comment, int line) {
      super(key, value, comment, line);
    }

    @Override
    public boolean isEnabled() {
      return false;
    }

    /**
     * Active copy keeping key, inline comment and line.
     *
     * @param value replacement value, or null to reactivate the remembered one
     */
    public Property enable(ConfigValue value) {
      return new Property(key(), value != null ? value : value(), comment(), line());
    }
  }

  public static final class Block implements Node, Container {
    private final String name;
    private final List<Node> children;
    private final int line;

    public Block(String name) {
      this(name, new ArrayList<>(), UNPOSITIONED);
    }

    public Block(String name, List<Node> children, int line) {
      this.name = Objects.requireNonNull(name, "name");
      this.children = new ArrayList<>(children);
      this.line = line;
    }

    public String name() {
      return name;
    }

    @Override
    public List<Node> children() {
      return children;
    }

    @Override
    public int line() {
      return line;
    }

    @Override
    public String toString() {
      return "Block{" + name + ", children=" + children.size() + "}";
    }
  }

  public static final class Root implements Container {
    private final List<Node> children;

    public Root() {
      this(new ArrayList<>());
    }

    public Root(List<Node> children) {
      this.children = new ArrayList<>(children);
    }

    @Override
    public List<Node> children() {
      return children;
    }

    @Override
    public String toString() {
      return "Root{children=" + children.size() + "}";
    }
  }

  /** Compares two trees node by node, ignoring line numbers. */
  public static boolean structurallyEqual(Root a, Root b) {
    return sameChildren(a.children(), b.children());
  }

  public static boolean structurallyEqual(Node a, Node b) {
    if (a instanceof Comment ca && b instanceof Comment cb) {
      return ca.content().equals(cb.content());
    }
    if (a instanceof Setting sa && b instanceof Setting sb) {
      return sa.isEnabled() == sb.isEnabled()
          && sa.key().equals(sb.key())
          && sa.value().equals(sb.value())
          && Objects.equals(sa.comment(), sb.comment());
    }
    if (a instanceof Block ba && b instanceof Block bb) {
      return ba.name().equals(bb.name()) && sameChildren(ba.children(), bb.children());
    }
    return false;
  }

  private static boolean sameChildren(List<Node> a, List<Node> b) {
    if (a.size() != b.size()) return false;
    for (int i = 0; i < a.size(); i++) {
      if (!structurallyEqual(a.get(i), b.get(i))) return false;
    }
    return true;
  }
}
