package org.robincores.vril.ir;

public final class IntLiteral extends Literal {
  private final long value;

  public IntLiteral(long value) {
    this.value = value;
  }

  public long value() {
    return value;
  }

  @Override
  public String text() {
    return Long.toString(value);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof IntLiteral && ((IntLiteral) o).value == value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return "Int(" + value + ")";
  }
}
