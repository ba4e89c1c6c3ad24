package org.robincores.vril.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Value operation over array-element identifiers, e.g.
 * {@code a[0]: int = v2a x;} or {@code x: int = a2v a[0];}.
 * <p>
 * At least one of the dest and the operands must contain a bracket. Without
 * one the instruction has the exact text of a {@link ValueOp}, which wins on
 * priority when read back.
 */
public final class ArrayOp extends Instruction {
  private final ArrayElementId dest;
  private final String type;
  private final String op;
  private final List<ArrayElementId> args;

  public ArrayOp(ArrayElementId dest, String type, String op, List<ArrayElementId> args) {
    this.dest = Objects.requireNonNull(dest, "dest");
    this.type = Names.requirePlainName(type, "type name");
    this.op = Names.requirePlainName(op, "opcode");
    this.args = Collections.unmodifiableList(new ArrayList<>(args));
    if (!dest.hasBrackets() && this.args.stream().noneMatch(ArrayElementId::hasBrackets)) {
      throw new IllegalArgumentException("Array op '" + op + "' has no array element identifier, use a value op");
    }
  }

  public static ArrayOp of(String dest, String type, String op, String... args) {
    List<ArrayElementId> ids = new ArrayList<>();
    for (String arg : args) {
      ids.add(new ArrayElementId(arg));
    }
    return new ArrayOp(new ArrayElementId(dest), type, op, ids);
  }

  public ArrayElementId dest() {
    return dest;
  }

  public String type() {
    return type;
  }

  public String op() {
    return op;
  }

  public List<ArrayElementId> args() {
    return args;
  }

  @Override
  public <R> R accept(InstructionVisitor<R> visitor) {
    return visitor.visit(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ArrayOp)) return false;
    ArrayOp that = (ArrayOp) o;
    return dest.equals(that.dest) && type.equals(that.type) && op.equals(that.op) && args.equals(that.args);
  }

  @Override
  public int hashCode() {
    return Objects.hash(dest, type, op, args);
  }

  @Override
  public String toString() {
    return "ArrayOp{" +
        "dest=" + dest +
        ", type='" + type + '\'' +
        ", op='" + op + '\'' +
        ", args=" + args +
        '}';
  }
}
