package org.robincores.vril.ir;

public final class BoolLiteral extends Literal {
  private final boolean value;

  public BoolLiteral(boolean value) {
    this.value = value;
  }

  public boolean value() {
    return value;
  }

  // Lowercase keyword only
  @Override
  public String text() {
    return value ? "true" : "false";
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof BoolLiteral && ((BoolLiteral) o).value == value;
  }

  @Override
  public int hashCode() {
    return Boolean.hashCode(value);
  }

  @Override
  public String toString() {
    return "Bool(" + value + ")";
  }
}
