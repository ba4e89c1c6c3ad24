package org.robincores.vril.ir;

// Constant operand of const/init: either IntLiteral or BoolLiteral
public abstract class Literal {
  Literal() {}

  public static Literal of(long value) {
    return new IntLiteral(value);
  }

  public static Literal of(boolean value) {
    return new BoolLiteral(value);
  }

  // Text form used by the pretty-printer; always readable by the grammar
  public abstract String text();
}
