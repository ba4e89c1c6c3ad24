package org.robincores.vril.text;

public final class Token {
  final TokenKind kind;
  final String text;
  final int line;
  final int column;

  Token(TokenKind kind, String text, int line, int column) {
    this.kind = kind;
    this.text = text;
    this.line = line;
    this.column = column;
  }

  public TokenKind kind() {
    return kind;
  }

  public String text() {
    return text;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  // Human readable form used in error messages
  String describe() {
    return kind == TokenKind.EOF ? "end of input" : "token '" + text + "'";
  }

  @Override
  public String toString() {
    return kind + "('" + text + "')@" + line + ":" + column;
  }
}
