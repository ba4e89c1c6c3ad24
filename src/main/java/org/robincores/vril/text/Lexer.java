package org.robincores.vril.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits source text into tokens. Whitespace and '#' comments are dropped.
 * <p>
 * Words are cut at maximal length over the widest identifier alphabet
 * (letters, digits, '_', '%', '.', '[' and ']'); deciding whether a word is a
 * name, a scalar identifier or an array element identifier is left to the
 * grammar's terminal classes, since the same word may be valid in one
 * position and not in another.
 */
public final class Lexer {
  private final String text;
  private int pos = 0;
  private int line = 1;
  private int column = 1;

  private Lexer(String text) {
    this.text = text;
  }

  public static List<Token> tokenize(String text) {
    return new Lexer(text).tokens();
  }

  private List<Token> tokens() {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      skipIgnored();
      if (pos >= text.length()) {
        tokens.add(new Token(TokenKind.EOF, "", line, column));
        return tokens;
      }
      tokens.add(next());
    }
  }

  private Token next() {
    int startLine = line;
    int startColumn = column;
    int start = pos;
    char c = text.charAt(pos);

    if (isWordStart(c)) {
      while (pos < text.length() && isWordPart(text.charAt(pos))) {
        advance();
      }
      return new Token(TokenKind.WORD, text.substring(start, pos), startLine, startColumn);
    }

    if (isDigit(c) || ((c == '-' || c == '+') && pos + 1 < text.length() && isDigit(text.charAt(pos + 1)))) {
      advance();
      while (pos < text.length() && isDigit(text.charAt(pos))) {
        advance();
      }
      return new Token(TokenKind.INT, text.substring(start, pos), startLine, startColumn);
    }

    TokenKind kind;
    switch (c) {
      case '{':
        kind = TokenKind.LBRACE;
        break;
      case '}':
        kind = TokenKind.RBRACE;
        break;
      case ':':
        kind = TokenKind.COLON;
        break;
      case '=':
        kind = TokenKind.EQUALS;
        break;
      case ';':
        kind = TokenKind.SEMI;
        break;
      default:
        throw new SyntaxException("Unexpected character '" + c + "'", startLine, startColumn);
    }
    advance();
    return new Token(kind, String.valueOf(c), startLine, startColumn);
  }

  // whitespace and comments
  private void skipIgnored() {
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f') {
        advance();
      } else if (c == '#') {
        while (pos < text.length() && text.charAt(pos) != '\n') {
          advance();
        }
      } else {
        return;
      }
    }
  }

  private void advance() {
    if (text.charAt(pos) == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    pos++;
  }

  static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  static boolean isLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  static boolean isWordStart(char c) {
    return isLetter(c) || c == '_' || c == '%';
  }

  static boolean isWordPart(char c) {
    return isWordStart(c) || isDigit(c) || c == '.' || c == '[' || c == ']';
  }
}
