package org.robincores.vril.text;

import java.util.ArrayList;
import java.util.List;

import org.robincores.vril.ir.ArrayElementId;
import org.robincores.vril.ir.ArrayOp;
import org.robincores.vril.ir.BoolLiteral;
import org.robincores.vril.ir.Const;
import org.robincores.vril.ir.EffectOp;
import org.robincores.vril.ir.Function;
import org.robincores.vril.ir.Init;
import org.robincores.vril.ir.Instruction;
import org.robincores.vril.ir.IntLiteral;
import org.robincores.vril.ir.Label;
import org.robincores.vril.ir.Literal;
import org.robincores.vril.ir.Program;
import org.robincores.vril.ir.ScalarId;
import org.robincores.vril.ir.ValueOp;

/**
 * Turns a parse tree into the structured representation, one method per node
 * kind. Stateless.
 */
public final class Lowering {

  private Lowering() {}

  public static Program lower(ParseNode start) {
    requireKind(start, "start");
    List<Function> functions = new ArrayList<>();
    for (Object child : start.children) {
      functions.add(function((ParseNode) child));
    }
    return new Program(functions);
  }

  static Function function(ParseNode node) {
    requireKind(node, "func");
    List<Object> items = node.children;
    String name = token(items, 0).text;
    List<Instruction> instrs = new ArrayList<>();
    for (Object item : items.subList(1, items.size())) {
      instrs.add(instruction((ParseNode) item));
    }
    return new Function(name, instrs);
  }

  static Instruction instruction(ParseNode node) {
    List<Object> items = node.children;
    switch (node.kind) {
      case "init":
        return new Init(scalar(token(items, 0)), type(items.get(1)), literal(items.get(2)));

      case "const":
        return new Const(scalar(token(items, 0)), type(items.get(1)), literal(items.get(2)));

      case "vop": {
        List<ScalarId> args = new ArrayList<>();
        for (int i = 3; i < items.size(); i++) {
          args.add(scalar(token(items, i)));
        }
        return new ValueOp(scalar(token(items, 0)), type(items.get(1)), token(items, 2).text, args);
      }

      case "aop": {
        List<ArrayElementId> args = new ArrayList<>();
        for (int i = 3; i < items.size(); i++) {
          args.add(new ArrayElementId(token(items, i).text));
        }
        return new ArrayOp(new ArrayElementId(token(items, 0).text), type(items.get(1)), token(items, 2).text, args);
      }

      case "eop": {
        List<ScalarId> args = new ArrayList<>();
        for (int i = 1; i < items.size(); i++) {
          args.add(scalar(token(items, i)));
        }
        return new EffectOp(token(items, 0).text, args);
      }

      case "label":
        return new Label(scalar(token(items, 0)));

      default:
        throw new IllegalStateException("Unexpected parse node '" + node.kind + "'");
    }
  }

  static String type(Object item) {
    ParseNode node = (ParseNode) item;
    requireKind(node, "type");
    return token(node.children, 0).text;
  }

  static Literal literal(Object item) {
    ParseNode node = (ParseNode) item;
    requireKind(node, "lit");
    Token t = token(node.children, 0);
    if (t.kind == TokenKind.INT) {
      try {
        return new IntLiteral(Long.parseLong(t.text));
      } catch (NumberFormatException e) {
        throw new LiteralException("Integer literal out of range: " + t.text, t.text, t.line, t.column);
      }
    }
    // case-sensitive: only the lowercase keywords are booleans
    if (t.text.equals("true")) {
      return new BoolLiteral(true);
    } else if (t.text.equals("false")) {
      return new BoolLiteral(false);
    }
    throw new LiteralException("Not a literal: " + t.text, t.text, t.line, t.column);
  }

  private static ScalarId scalar(Token t) {
    return new ScalarId(t.text);
  }

  private static Token token(List<Object> items, int index) {
    return (Token) items.get(index);
  }

  private static void requireKind(ParseNode node, String kind) {
    if (!node.kind.equals(kind)) {
      throw new IllegalStateException("Expected '" + kind + "' node, got '" + node.kind + "'");
    }
  }
}
