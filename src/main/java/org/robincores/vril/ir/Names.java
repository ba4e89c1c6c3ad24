package org.robincores.vril.ir;

import java.util.Objects;
import java.util.regex.Pattern;

// Lexical classes shared by the data model and the text grammar
public final class Names {
  // Function names, opcodes and type names
  static final Pattern PLAIN = Pattern.compile("[_A-Za-z][_A-Za-z0-9]*");
  static final Pattern SCALAR = Pattern.compile("[_%A-Za-z][_%.A-Za-z0-9]*");
  // Brackets are plain characters here, any count and any order
  static final Pattern ARRAY_ELEMENT = Pattern.compile("[_%A-Za-z][_%.A-Za-z0-9\\[\\]]*");

  private Names() {}

  public static boolean isPlainName(String s) {
    return s != null && PLAIN.matcher(s).matches();
  }

  public static boolean isScalarId(String s) {
    return s != null && SCALAR.matcher(s).matches();
  }

  public static boolean isArrayElementId(String s) {
    return s != null && ARRAY_ELEMENT.matcher(s).matches();
  }

  public static boolean hasBrackets(String s) {
    return s.indexOf('[') >= 0 || s.indexOf(']') >= 0;
  }

  static String requirePlainName(String s, String what) {
    return require(PLAIN, s, what);
  }

  static String require(Pattern pattern, String s, String what) {
    Objects.requireNonNull(s, what);
    if (!pattern.matcher(s).matches()) {
      throw new IllegalArgumentException("Invalid " + what + ": '" + s + "'");
    }
    return s;
  }
}
