package com.onkiup.linker.lexer;

/**
 * Classification of a text window against a {@link Rule}
 */
public enum MatchType {
  /**
   * The window cannot be a part of any text matched by the rule
   */
  NONE,
  /**
   * The window is a proper prefix of some text the rule could match
   */
  PARTIAL,
  /**
   * The window is a complete match
   */
  MATCH;

  public static <X> MatchResult<X> none() {
    return NONE.result(null);
  }

  public static <X> MatchResult<X> partial() {
    return PARTIAL.result(null);
  }

  public static <X> MatchResult<X> match() {
    return MATCH.result(null);
  }

  public static <X> MatchResult<X> match(X value) {
    return MATCH.result(value);
  }

  public <X> MatchResult<X> result(X value) {
    return new MatchResult<>(this, value);
  }
}
