package org.robincores.vril.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

// dest: type = op args...; with scalar identifiers only
public final class ValueOp extends Instruction {
  private final ScalarId dest;
  private final String type;
  private final String op;
  private final List<ScalarId> args;

  public ValueOp(ScalarId dest, String type, String op, List<ScalarId> args) {
    this.dest = Objects.requireNonNull(dest, "dest");
    this.type = Names.requirePlainName(type, "type name");
    this.op = Names.requirePlainName(op, "opcode");
    this.args = Collections.unmodifiableList(new ArrayList<>(args));
    // `x: bool = const true;` is a Const in text form, so this shape could not be read back
    if ((Const.OP.equals(op) || Init.OP.equals(op)) && this.args.size() == 1) {
      String arg = this.args.get(0).name();
      if (arg.equals("true") || arg.equals("false")) {
        throw new IllegalArgumentException("Value op '" + op + " " + arg + "' is indistinguishable from a literal " + op);
      }
    }
  }

  public static ValueOp of(String dest, String type, String op, String... args) {
    List<ScalarId> ids = new ArrayList<>();
    for (String arg : args) {
      ids.add(new ScalarId(arg));
    }
    return new ValueOp(new ScalarId(dest), type, op, ids);
  }

  public ScalarId dest() {
    return dest;
  }

  public String type() {
    return type;
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
    if (!(o instanceof ValueOp)) return false;
    ValueOp that = (ValueOp) o;
    return dest.equals(that.dest) && type.equals(that.type) && op.equals(that.op) && args.equals(that.args);
  }

  @Override
  public int hashCode() {
    return Objects.hash(dest, type, op, args);
  }

  @Override
  public String toString() {
    return "ValueOp{" +
        "dest=" + dest +
        ", type='" + type + '\'' +
        ", op='" + op + '\'' +
        ", args=" + args +
        '}';
  }
}
