package org.robincores.vril.ir;

import java.util.Objects;

// Shared shape of const and init: dest, type and a literal value
public abstract class LiteralInstruction extends Instruction {
  private final ScalarId dest;
  private final String type;
  private final Literal value;

  LiteralInstruction(ScalarId dest, String type, Literal value) {
    this.dest = Objects.requireNonNull(dest, "dest");
    this.type = Names.requirePlainName(type, "type name");
    this.value = Objects.requireNonNull(value, "value");
  }

  // Opcode keyword, "const" or "init"
  public abstract String op();

  public ScalarId dest() {
    return dest;
  }

  public String type() {
    return type;
  }

  public Literal value() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || o.getClass() != getClass()) return false;
    LiteralInstruction that = (LiteralInstruction) o;
    return dest.equals(that.dest) && type.equals(that.type) && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(op(), dest, type, value);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" +
        "dest=" + dest +
        ", type='" + type + '\'' +
        ", value=" + value +
        '}';
  }
}
