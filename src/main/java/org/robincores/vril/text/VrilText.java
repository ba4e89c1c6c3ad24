package org.robincores.vril.text;

import java.util.List;

import org.robincores.vril.ir.Program;

/**
 * Entry points for both directions. Each call is a pure function of its
 * argument and may run concurrently with any other.
 */
public final class VrilText {

  private VrilText() {}

  /**
   * Parses and lowers source text.
   *
   * @throws SyntaxException if the text is not derivable from the grammar
   * @throws LiteralException if a literal token has no value
   */
  public static Program parse(String text) {
    return Lowering.lower(Parser.parse(text));
  }

  // Lines of the text form, without line terminators
  public static List<String> print(Program program) {
    return TextPrinter.print(program);
  }

  // Whole text form, each line terminated by '\n'
  public static String format(Program program) {
    StringBuilder sb = new StringBuilder();
    for (String line : print(program)) {
      sb.append(line).append('\n');
    }
    return sb.toString();
  }
}
