package io.hyprconf.parser.impl;

import io.hyprconf.parser.api.ConfigTree.Block;
import io.hyprconf.parser.api.ConfigTree.Comment;
import io.hyprconf.parser.api.ConfigTree.CommentedProperty;
import io.hyprconf.parser.api.ConfigTree.Node;
import io.hyprconf.parser.api.ConfigTree.Root;
import io.hyprconf.parser.api.ConfigTree.Setting;
import java.util.List;
import java.util.StringJoiner;

/** Renders a config tree back to text, two spaces of indent per nesting level. */
public final class ConfigSerializer {
  private static final String INDENT = "  ";

  private final boolean preserveComments;

  private ConfigSerializer(boolean preserveComments) {
    this.preserveComments = preserveComments;
  }

  public static String serialize(Root root, boolean preserveComments) {
    return new ConfigSerializer(preserveComments).renderChildren(root.children(), 0) + "\n";
  }

  private String renderChildren(List<Node> children, int depth) {
    StringJoiner joiner = new StringJoiner("\n");
    for (Node child : children) {
      String rendered = render(child, depth);
      if (!rendered.isEmpty()) joiner.add(rendered);
    }
    return joiner.toString();
  }

  private String render(Node node, int depth) {
    String indent = INDENT.repeat(depth);
    if (node instanceof Comment c) {
      return preserveComments ? indent + commentText(c.content()) : "";
    }
    if (node instanceof Setting s) {
      StringBuilder sb = new StringBuilder(indent);
      if (s instanceof CommentedProperty) sb.append("# ");
      sb.append(s.key()).append(" = ").append(s.value().render());
      if (preserveComments && s.comment() != null) sb.append(' ').append(commentText(s.comment()));
      return sb.toString();
    }
    Block b = (Block) node;
    String body = renderChildren(b.children(), depth + 1);
    return indent + b.name() + " {\n" + (body.isEmpty() ? "" : body + "\n") + indent + "}";
  }

  private static String commentText(String content) {
    return content.isEmpty() ? "#" : "# " + content;
  }
}
