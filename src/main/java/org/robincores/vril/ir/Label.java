package org.robincores.vril.ir;

import java.util.Objects;

// Jump target; carries no operands
public final class Label extends Instruction {
  private final ScalarId name;

  public Label(ScalarId name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public static Label of(String name) {
    return new Label(new ScalarId(name));
  }

  public ScalarId name() {
    return name;
  }

  @Override
  public <R> R accept(InstructionVisitor<R> visitor) {
    return visitor.visit(this);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Label && ((Label) o).name.equals(name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return "Label{" + name + '}';
  }
}
