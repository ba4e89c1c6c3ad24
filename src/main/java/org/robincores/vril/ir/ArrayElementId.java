package org.robincores.vril.ir;

/**
 * Identifier of the array-element class. Same alphabet as {@link ScalarId}
 * plus literal '[' and ']'. The brackets are not an index expression, so
 * {@code a[0}, {@code a]]} and {@code a[i][j]} are all accepted.
 */
public final class ArrayElementId {
  private final String name;

  public ArrayElementId(String name) {
    this.name = Names.require(Names.ARRAY_ELEMENT, name, "array element identifier");
  }

  public static ArrayElementId of(String name) {
    return new ArrayElementId(name);
  }

  public String name() {
    return name;
  }

  public boolean hasBrackets() {
    return Names.hasBrackets(name);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ArrayElementId && ((ArrayElementId) o).name.equals(name);
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
