package org.robincores.vril.ir;

public interface InstructionVisitor<R> {
  R visit(Label label);

  R visit(Const constant);

  R visit(Init init);

  R visit(ValueOp op);

  R visit(ArrayOp op);

  R visit(EffectOp op);
}
