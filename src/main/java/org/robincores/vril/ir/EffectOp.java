package org.robincores.vril.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

// Side-effecting op with no dest and no type (print, jmp, br, ret, ...)
public final class EffectOp extends Instruction {
  private final String op;
  private final List<ScalarId> args;

  public EffectOp(String op, List<ScalarId> args) {
    this.op = Names.requirePlainName(op, "opcode");
    this.args = Collections.unmodifiableList(new ArrayList<>(args));
  }

  public static EffectOp of(String op, String... args) {
    List<ScalarId> ids = new ArrayList<>();
    for (String arg : args) {
      ids.add(new ScalarId(arg));
    }
    return new EffectOp(op, ids);
  }

  public String op() {
    return op;
  }

  public List<ScalarId> args() {
    return args;
  }

  @Override
  public <R> R accept(InstructionVisitor<R> visitor) {
    return visitor.visit(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EffectOp)) return false;
    EffectOp that = (EffectOp) o;
    return op.equals(that.op) && args.equals(that.args);
  }

  @Override
  public int hashCode() {
    return Objects.hash(op, args);
  }

  @Override
  public String toString() {
    return "EffectOp{" +
        "op='" + op + '\'' +
        ", args=" + args +
        '}';
  }
}
