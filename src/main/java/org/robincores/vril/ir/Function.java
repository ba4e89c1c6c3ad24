package org.robincores.vril.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

// A named function; instruction order is execution order and is kept as given
public final class Function {
  private final String name;
  private final List<Instruction> instrs;

  public Function(String name, List<Instruction> instrs) {
    this.name = Names.requirePlainName(name, "function name");
    this.instrs = Collections.unmodifiableList(new ArrayList<>(instrs));
  }

  public static Function of(String name, Instruction... instrs) {
    return new Function(name, Arrays.asList(instrs));
  }

  public String name() {
    return name;
  }

  public List<Instruction> instrs() {
    return instrs;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Function)) return false;
    Function that = (Function) o;
    return name.equals(that.name) && instrs.equals(that.instrs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, instrs);
  }

  @Override
  public String toString() {
    return "Function{" +
        "name='" + name + '\'' +
        ", instrs=" + instrs +
        '}';
  }
}
