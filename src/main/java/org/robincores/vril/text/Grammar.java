package org.robincores.vril.text;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The text grammar:
 * <pre>
 *   start    : func*
 *   func     : name "{" instr* "}"
 *   init.6   : ident ":" type "=" "init" lit ";"
 *   const.5  : ident ":" type "=" "const" lit ";"
 *   vop.4    : ident ":" type "=" name ident* ";"
 *   aop.3    : aident ":" type "=" name aident* ";"
 *   eop.2    : name ident* ";"
 *   label.1  : ident ":"
 * </pre>
 * Instruction rules overlap (a boolean keyword is also an identifier, and
 * every identifier is also an array element identifier), so the parser tries
 * them in {@link #PRIORITY_ORDER} and keeps the first one that matches.
 */
public final class Grammar {

  // A ~variable: the token class it accepts and the node kind wrapping it, if any
  static final class Variable {
    final String name;
    final TerminalClass terminal;
    final String node;

    Variable(String name, TerminalClass terminal, String node) {
      this.name = name;
      this.terminal = terminal;
      this.node = node;
    }
  }

  static final Map<String, Variable> VARS;

  static {
    Map<String, Variable> vars = new LinkedHashMap<>();
    vars.put("name", new Variable("name", TerminalClass.CNAME, null));
    vars.put("ident", new Variable("ident", TerminalClass.IDENT, null));
    vars.put("aident", new Variable("aident", TerminalClass.AIDENT, null));
    vars.put("type", new Variable("type", TerminalClass.CNAME, "type"));
    vars.put("lit", new Variable("lit", TerminalClass.LIT, "lit"));
    VARS = Collections.unmodifiableMap(vars);
  }

  static final Variable FUNCTION_NAME = VARS.get("name");

  /** Instruction rules, highest priority first. */
  public static final List<GrammarRule> INSTRUCTION_RULES = sortByPriority(Arrays.asList(
      new GrammarRule("init", 6, "~ident : ~type = init ~lit ;", VARS),
      new GrammarRule("const", 5, "~ident : ~type = const ~lit ;", VARS),
      new GrammarRule("vop", 4, "~ident : ~type = ~name ~ident* ;", VARS),
      new GrammarRule("aop", 3, "~aident : ~type = ~name ~aident* ;", VARS),
      new GrammarRule("eop", 2, "~name ~ident* ;", VARS),
      new GrammarRule("label", 1, "~ident :", VARS)
  ));

  /** Rule names in the order they are tried. */
  public static final List<String> PRIORITY_ORDER = names(INSTRUCTION_RULES);

  private Grammar() {}

  static List<GrammarRule> sortByPriority(List<GrammarRule> rules) {
    List<GrammarRule> sorted = new ArrayList<>(rules);
    sorted.sort(Comparator.comparingInt((GrammarRule r) -> r.priority).reversed());
    for (int i = 1; i < sorted.size(); i++) {
      if (sorted.get(i).priority == sorted.get(i - 1).priority) {
        throw new IllegalArgumentException("Rules '" + sorted.get(i - 1).name + "' and '"
            + sorted.get(i).name + "' share priority " + sorted.get(i).priority);
      }
    }
    return Collections.unmodifiableList(sorted);
  }

  private static List<String> names(List<GrammarRule> rules) {
    List<String> names = new ArrayList<>();
    for (GrammarRule rule : rules) {
      names.add(rule.name);
    }
    return Collections.unmodifiableList(names);
  }
}
