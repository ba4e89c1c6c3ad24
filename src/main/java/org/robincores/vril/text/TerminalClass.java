package org.robincores.vril.text;

import org.robincores.vril.ir.Names;

// Lexical classes a rule variable (~name) can require of a token
public enum TerminalClass {
  CNAME("name") {
    @Override
    boolean matches(Token t) {
      return t.kind == TokenKind.WORD && Names.isPlainName(t.text);
    }
  },
  IDENT("identifier") {
    @Override
    boolean matches(Token t) {
      return t.kind == TokenKind.WORD && Names.isScalarId(t.text);
    }
  },
  AIDENT("array element identifier") {
    @Override
    boolean matches(Token t) {
      return t.kind == TokenKind.WORD && Names.isArrayElementId(t.text);
    }
  },
  LIT("literal") {
    @Override
    boolean matches(Token t) {
      return t.kind == TokenKind.INT || (t.kind == TokenKind.WORD && isBoolKeyword(t.text));
    }
  };

  final String description;

  TerminalClass(String description) {
    this.description = description;
  }

  abstract boolean matches(Token t);

  static boolean isBoolKeyword(String s) {
    return s.equals("true") || s.equals("false");
  }
}
