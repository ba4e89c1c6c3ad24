package org.robincores.vril.text;

public enum TokenKind {
  WORD,     // names and identifiers, including the true/false keywords
  INT,      // signed decimal integer
  LBRACE,
  RBRACE,
  COLON,
  EQUALS,
  SEMI,
  EOF
}
