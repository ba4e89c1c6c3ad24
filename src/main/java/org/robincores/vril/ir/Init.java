package org.robincores.vril.ir;

// Same fields as Const, but tagged as an initialization
public final class Init extends LiteralInstruction {
  public static final String OP = "init";

  public Init(ScalarId dest, String type, Literal value) {
    super(dest, type, value);
  }

  public static Init of(String dest, String type, Literal value) {
    return new Init(new ScalarId(dest), type, value);
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
