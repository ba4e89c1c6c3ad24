package org.robincores.vril.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Concrete parse tree node. The kind is the name of the rule that produced
 * it ({@code start}, {@code func}, {@code init}, {@code const}, {@code vop},
 * {@code aop}, {@code eop}, {@code label}, {@code lit} or {@code type}); each
 * child is either a {@link Token} or a nested {@code ParseNode}. Keywords and
 * punctuation are not kept.
 */
public final class ParseNode {
  final String kind;
  final List<Object> children;

  ParseNode(String kind, List<Object> children) {
    this.kind = kind;
    this.children = Collections.unmodifiableList(new ArrayList<>(children));
  }

  public String kind() {
    return kind;
  }

  public List<Object> children() {
    return children;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(kind).append('(');
    for (int i = 0; i < children.size(); i++) {
      if (i > 0) sb.append(' ');
      Object child = children.get(i);
      sb.append(child instanceof Token ? ((Token) child).text : child.toString());
    }
    return sb.append(')').toString();
  }
}
