package org.robincores.vril.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a parse tree from source text. Each instruction position tries
 * {@link Grammar#INSTRUCTION_RULES} highest priority first and takes the first
 * match. That picks the same derivation a priority-resolving general parser
 * would: every rule but {@code label} ends in ';', and a label cut from the
 * front of a longer rule leaves {@code <type> =} in instruction position,
 * which no rule derives.
 * <p>
 * Errors report the furthest token any attempted rule reached, with what was
 * expected there.
 * <p>
 * There is no recovery: the first error ends the parse.
 */
public final class Parser {
  private final List<Token> tokens;
  private final Expectations expectations = new Expectations();
  private int pos = 0;

  private Parser(List<Token> tokens) {
    this.tokens = tokens;
  }

  public static ParseNode parse(String text) {
    return new Parser(Lexer.tokenize(text)).parseProgram();
  }

  private ParseNode parseProgram() {
    List<Object> funcs = new ArrayList<>();
    while (peek().kind != TokenKind.EOF) {
      funcs.add(parseFunction());
    }
    return new ParseNode("start", funcs);
  }

  ParseNode parseFunction() {
    List<Object> children = new ArrayList<>();
    children.add(expect(Grammar.FUNCTION_NAME.terminal, "function name"));
    expect(TokenKind.LBRACE, "'{'");
    while (peek().kind != TokenKind.RBRACE) {
      children.add(parseInstruction());
    }
    pos++;
    return new ParseNode("func", children);
  }

  ParseNode parseInstruction() {
    expectations.expect(pos, "'}'");
    for (GrammarRule rule : Grammar.INSTRUCTION_RULES) {
      GrammarRule.Match m = rule.match(tokens, pos, expectations);
      if (m != null) {
        pos = m.end;
        return m.node;
      }
    }
    throw expectations.error(tokens);
  }

  private Token peek() {
    return tokens.get(pos);
  }

  private Token expect(TerminalClass terminal, String description) {
    Token t = peek();
    if (!terminal.matches(t)) {
      expectations.expect(pos, description);
      throw expectations.error(tokens);
    }
    pos++;
    return t;
  }

  private Token expect(TokenKind kind, String description) {
    Token t = peek();
    if (t.kind != kind) {
      expectations.expect(pos, description);
      throw expectations.error(tokens);
    }
    pos++;
    return t;
  }
}
