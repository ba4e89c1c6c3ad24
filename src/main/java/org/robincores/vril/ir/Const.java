package org.robincores.vril.ir;

public final class Const extends LiteralInstruction {
  public static final String OP = "const";

  public Const(ScalarId dest, String type, Literal value) {
    super(dest, type, value);
  }

  public static Const of(String dest, String type, Literal value) {
    return new Const(new ScalarId(dest), type, value);
  }

  @Override
  public String op() {
    return OP;
  }

  @Override
  public <R> R accept(InstructionVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
