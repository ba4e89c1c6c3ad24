package org.robincores.vril.ir;

/**
 * One entry of a function body. The variants are fixed: {@link Label},
 * {@link Const}, {@link Init}, {@link ValueOp}, {@link ArrayOp} and
 * {@link EffectOp}. Constructors are package-private so no other variant can
 * be added from outside; use {@link #accept} to dispatch on the variant.
 */
public abstract class Instruction {
  Instruction() {}

  public abstract <R> R accept(InstructionVisitor<R> visitor);
}
