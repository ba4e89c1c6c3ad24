package org.robincores.vril.text;

import org.robincores.vril.ConversionException;

// A literal token the grammar accepted has no value (e.g. an integer out of range)
public class LiteralException extends ConversionException {
  private final String literal;

  LiteralException(String reason, String literal, int line, int column) {
    super(reason, line, column);
    this.literal = literal;
  }

  public String literal() {
    return literal;
  }
}
