package com.onkiup.linker.lexer.rule;

import java.util.Objects;

import com.onkiup.linker.lexer.MatchResult;
import com.onkiup.linker.lexer.MatchType;
import com.onkiup.linker.lexer.Rule;

/**
 * Matches text equal to the configured literal; any prefix of the literal is a partial match
 */
public class LiteralRule<X> implements Rule<X> {

  private final String literal;
  private final int literalLen;
  private final boolean ignoreCase;

  public LiteralRule(String literal, boolean ignoreCase) {
    this.literal = Objects.requireNonNull(literal, "literal");
    this.literalLen = literal.length();
    this.ignoreCase = ignoreCase;
  }

  @Override
  public MatchResult<X> matches(CharSequence window) {
    int windowLen = window.length();
    if (windowLen > literalLen) {
      return MatchType.none();
    }

    int windowPos = 0, literalPos = 0;
    while (windowPos < windowLen) {
      if (literalPos >= literalLen) {
        return MatchType.none();
      }
      int windowChar = Character.codePointAt(window, windowPos);
      int literalChar = literal.codePointAt(literalPos);
      windowPos += Character.charCount(windowChar);
      literalPos += Character.charCount(literalChar);
      if (ignoreCase ? Character.toLowerCase(windowChar) != Character.toLowerCase(literalChar) : windowChar != literalChar) {
        return MatchType.none();
      }
    }

    return literalPos == literalLen ? MatchType.match() : MatchType.partial();
  }

  public String literal() {
    return literal;
  }

  @Override
  public String toString() {
    return ignoreCase ? "Literal[" + literal + "; ignoreCase]" : "Literal[" + literal + "]";
  }
}
