package org.robincores.vril.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class InstructionTest {

  @Test void constAndInitWithSameFieldsDiffer() {
    Const c = Const.of("v", "int", Literal.of(4));
    Init i = Init.of("v", "int", Literal.of(4));
    assertNotEquals(c, i);
    assertEquals(c, Const.of("v", "int", new IntLiteral(4)));
    assertEquals("const", c.op());
    assertEquals("init", i.op());
  }

  @Test void literalsCompareByValue() {
    assertEquals(new IntLiteral(-42), Literal.of(-42));
    assertEquals(new BoolLiteral(true), Literal.of(true));
    assertNotEquals(Literal.of(1), Literal.of(true));
    assertEquals("false", Literal.of(false).text());
    assertEquals("-42", Literal.of(-42).text());
  }

  @Test void arrayOpNeedsABracketedIdentifier() {
    assertThrows(IllegalArgumentException.class, () -> ArrayOp.of("x", "int", "add", "a", "b"));
    assertEquals(1, ArrayOp.of("x", "int", "a2v", "a[0]").args().size());
    assertEquals("a[0]", ArrayOp.of("a[0]", "int", "v2a", "x").dest().name());
  }

  @Test void valueOpThatReadsAsLiteralIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ValueOp.of("x", "bool", "const", "true"));
    assertThrows(IllegalArgumentException.class, () -> ValueOp.of("x", "bool", "init", "false"));
    // other operands are fine
    assertEquals("const", ValueOp.of("x", "int", "const", "y").op());
    assertEquals(2, ValueOp.of("x", "bool", "const", "true", "y").args().size());
  }

  @Test void namesMustBePlain() {
    assertThrows(IllegalArgumentException.class, () -> EffectOp.of("pr.int", "x"));
    assertThrows(IllegalArgumentException.class, () -> Const.of("x", "ptr<int>", Literal.of(1)));
    assertThrows(IllegalArgumentException.class, () -> Function.of("%main"));
  }

  @Test void listsAreCopiedAndReadOnly() {
    List<ScalarId> args = new ArrayList<>(Arrays.asList(ScalarId.of("a")));
    EffectOp op = new EffectOp("print", args);
    args.add(ScalarId.of("b"));
    assertEquals(1, op.args().size());
    assertThrows(UnsupportedOperationException.class, () -> op.args().add(ScalarId.of("c")));
    assertThrows(UnsupportedOperationException.class,
        () -> new Program(Collections.emptyList()).functions().add(Function.of("f")));
  }

  @Test void visitorDispatchesOnVariant() {
    InstructionVisitor<String> kind = new InstructionVisitor<String>() {
      public String visit(Label label) { return "label"; }
      public String visit(Const constant) { return "const"; }
      public String visit(Init init) { return "init"; }
      public String visit(ValueOp op) { return "vop"; }
      public String visit(ArrayOp op) { return "aop"; }
      public String visit(EffectOp op) { return "eop"; }
    };
    assertEquals("label", Label.of("l").accept(kind));
    assertEquals("init", Init.of("x", "int", Literal.of(0)).accept(kind));
    assertEquals("aop", ArrayOp.of("a[1]", "int", "v2a", "x").accept(kind));
    assertEquals("eop", EffectOp.of("ret").accept(kind));
  }
}
