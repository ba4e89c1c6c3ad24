package org.robincores.vril.text;

import java.util.ArrayList;
import java.util.List;

import org.robincores.vril.ir.ArrayOp;
import org.robincores.vril.ir.Const;
import org.robincores.vril.ir.EffectOp;
import org.robincores.vril.ir.Function;
import org.robincores.vril.ir.Init;
import org.robincores.vril.ir.Instruction;
import org.robincores.vril.ir.InstructionVisitor;
import org.robincores.vril.ir.Label;
import org.robincores.vril.ir.LiteralInstruction;
import org.robincores.vril.ir.Program;
import org.robincores.vril.ir.ValueOp;

/**
 * Renders a program in the text syntax, one line per element:
 * <pre>
 * main {
 *   v: int = const 4;
 *   loop:
 *   print v;
 * }
 * </pre>
 * Output is always accepted by {@link Parser} and lowers back to an equal
 * program. Comments and original layout are not preserved.
 */
public final class TextPrinter implements InstructionVisitor<String> {
  static final String INDENT = "  ";

  private static final TextPrinter INSTANCE = new TextPrinter();

  private TextPrinter() {}

  public static List<String> print(Program program) {
    List<String> lines = new ArrayList<>();
    for (Function function : program.functions()) {
      lines.addAll(print(function));
    }
    return lines;
  }

  public static List<String> print(Function function) {
    List<String> lines = new ArrayList<>();
    lines.add(function.name() + " {");
    for (Instruction instr : function.instrs()) {
      lines.add(INDENT + instr.accept(INSTANCE));
    }
    lines.add("}");
    return lines;
  }

  public static String print(Instruction instr) {
    return instr.accept(INSTANCE);
  }

  @Override
  public String visit(Label label) {
    return label.name() + ":";
  }

  @Override
  public String visit(Const constant) {
    return literalInstruction(constant);
  }

  @Override
  public String visit(Init init) {
    return literalInstruction(init);
  }

  @Override
  public String visit(ValueOp op) {
    return op.dest() + ": " + op.type() + " = " + join(op.op(), op.args()) + ";";
  }

  @Override
  public String visit(ArrayOp op) {
    return op.dest() + ": " + op.type() + " = " + join(op.op(), op.args()) + ";";
  }

  @Override
  public String visit(EffectOp op) {
    return join(op.op(), op.args()) + ";";
  }

  private static String literalInstruction(LiteralInstruction instr) {
    return instr.dest() + ": " + instr.type() + " = " + instr.op() + " " + instr.value().text() + ";";
  }

  // Opcode followed by operands, single-space separated; no trailing space without operands
  private static String join(String op, List<?> args) {
    StringBuilder sb = new StringBuilder(op);
    for (Object arg : args) {
      sb.append(' ').append(arg);
    }
    return sb.toString();
  }
}
