package org.robincores.vril.ir;

// Identifier of the scalar class: letters, digits, '_', '%' and '.'
public final class ScalarId {
  private final String name;

  public ScalarId(String name) {
    this.name = Names.require(Names.SCALAR, name, "scalar identifier");
  }

  public static ScalarId of(String name) {
    return new ScalarId(name);
  }

  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ScalarId && ((ScalarId) o).name.equals(name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
