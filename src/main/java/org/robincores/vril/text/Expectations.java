package org.robincores.vril.text;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

// Records what was expected at the furthest token any attempt reached
final class Expectations {
  private int furthest = -1;
  private final Set<String> expected = new LinkedHashSet<>();

  void expect(int index, String description) {
    if (index > furthest) {
      furthest = index;
      expected.clear();
    }
    if (index == furthest) {
      expected.add(description);
    }
  }

  SyntaxException error(List<Token> tokens) {
    Token token = tokens.get(Math.min(furthest, tokens.size() - 1));
    return SyntaxException.unexpected(token, new ArrayList<>(expected));
  }
}
