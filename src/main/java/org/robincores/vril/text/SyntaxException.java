package org.robincores.vril.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.robincores.vril.ConversionException;

// Input text cannot be derived from the grammar
public class SyntaxException extends ConversionException {
  private final String token;
  private final List<String> expected;

  SyntaxException(String reason, int line, int column) {
    this(reason, null, Collections.emptyList(), line, column);
  }

  SyntaxException(String reason, String token, List<String> expected, int line, int column) {
    super(reason, line, column);
    this.token = token;
    this.expected = Collections.unmodifiableList(new ArrayList<>(expected));
  }

  static SyntaxException unexpected(Token token, List<String> expected) {
    String reason = "Unexpected " + token.describe();
    if (!expected.isEmpty()) {
      reason += ", expected " + String.join(" or ", expected);
    }
    return new SyntaxException(reason, token.kind == TokenKind.EOF ? null : token.text, expected,
        token.line, token.column);
  }

  // Text of the offending token, or null at end of input
  public String token() {
    return token;
  }

  public List<String> expected() {
    return expected;
  }
}
