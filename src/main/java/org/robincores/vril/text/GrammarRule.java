package org.robincores.vril.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * An instruction production written as a format string, e.g.
 * {@code "~ident : ~type = const ~lit ;"}.
 * <p>
 * {@code ~name} refers to a grammar variable, {@code ~name*} to zero or more
 * of them; any other word is a keyword or punctuation that must appear as
 * written and is left out of the parse tree. Repetitions match greedily,
 * which is exact as long as a repeated class never matches the token that
 * follows it (no terminal class matches punctuation).
 */
public final class GrammarRule {
  final String name;
  final int priority;
  final String fmt;
  final List<Element> elements;

  GrammarRule(String name, int priority, String fmt, Map<String, Grammar.Variable> vars) {
    this.name = name;
    this.priority = priority;
    this.fmt = fmt;
    this.elements = Collections.unmodifiableList(compile(fmt, vars));
  }

  // One position of the format string
  static final class Element {
    final String keyword;             // set for keywords and punctuation
    final Grammar.Variable variable;  // set for ~variables
    final boolean repeated;

    Element(String keyword, Grammar.Variable variable, boolean repeated) {
      this.keyword = keyword;
      this.variable = variable;
      this.repeated = repeated;
    }

    boolean matches(Token t) {
      return variable != null ? variable.terminal.matches(t) : t.kind != TokenKind.EOF && t.text.equals(keyword);
    }

    String describe() {
      return variable != null ? variable.terminal.description : "'" + keyword + "'";
    }

    Object capture(Token t) {
      if (variable.node == null) {
        return t;
      }
      List<Object> children = new ArrayList<>();
      children.add(t);
      return new ParseNode(variable.node, children);
    }
  }

  // Successful match: the node and the index of the first token after it
  static final class Match {
    final ParseNode node;
    final int end;

    Match(ParseNode node, int end) {
      this.node = node;
      this.end = end;
    }
  }

  static List<Element> compile(String fmt, Map<String, Grammar.Variable> vars) {
    if (fmt == null || fmt.trim().isEmpty()) {
      throw new IllegalArgumentException("Each rule must have a non-empty format");
    }
    List<Element> elements = new ArrayList<>();
    for (String part : fmt.trim().split("\\s+")) {
      if (part.startsWith("~")) {
        boolean repeated = part.endsWith("*");
        String varname = part.substring(1, repeated ? part.length() - 1 : part.length());
        Grammar.Variable v = vars.get(varname);
        if (v == null) {
          throw new IllegalArgumentException("Could not find variable definition for '~" + varname + "'");
        }
        elements.add(new Element(null, v, repeated));
      } else {
        elements.add(new Element(part, null, false));
      }
    }
    return elements;
  }

  // Matches starting at tokens[start]; on failure records what was expected and returns null
  Match match(List<Token> tokens, int start, Expectations expectations) {
    List<Object> children = new ArrayList<>();
    int i = start;
    for (Element e : elements) {
      if (e.repeated) {
        while (e.matches(tokens.get(i))) {
          children.add(e.capture(tokens.get(i)));
          i++;
        }
        expectations.expect(i, e.describe());
        continue;
      }
      Token t = tokens.get(i);
      if (!e.matches(t)) {
        expectations.expect(i, e.describe());
        return null;
      }
      if (e.variable != null) {
        children.add(e.capture(t));
      }
      i++;
    }
    return new Match(new ParseNode(name, children), i);
  }

  public String name() {
    return name;
  }

  public int priority() {
    return priority;
  }

  public String fmt() {
    return fmt;
  }

  @Override
  public String toString() {
    return "GrammarRule{" +
        "name='" + name + '\'' +
        ", priority=" + priority +
        ", fmt='" + fmt + '\'' +
        '}';
  }
}
