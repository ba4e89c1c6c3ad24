package org.robincores.vril.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

// Root of the structured representation
public final class Program {
  private final List<Function> functions;

  public Program(List<Function> functions) {
    this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
  }

  public static Program of(Function... functions) {
    return new Program(Arrays.asList(functions));
  }

  public List<Function> functions() {
    return functions;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Program && ((Program) o).functions.equals(functions);
  }

  @Override
  public int hashCode() {
    return functions.hashCode();
  }

  @Override
  public String toString() {
    return "Program{" +
        "functions=" + functions +
        '}';
  }
}
