package com.onkiup.linker.lexer.rule;

import java.util.Objects;

import com.onkiup.linker.lexer.MatchResult;
import com.onkiup.linker.lexer.MatchType;
import com.onkiup.linker.lexer.Rule;

/**
 * Strict conjunction: matches only when both rules fully match the window.
 * Partial matches are not propagated and values of the nested rules are dropped.
 */
public class BothRule<X> implements Rule<X> {

  private final Rule<?> first;
  private final Rule<?> second;

  public BothRule(Rule<?> first, Rule<?> second) {
    this.first = Objects.requireNonNull(first, "first");
    this.second = Objects.requireNonNull(second, "second");
  }

  @Override
  public MatchResult<X> matches(CharSequence window) {
    if (first.matches(window).isMatch() && second.matches(window).isMatch()) {
      return MatchType.match();
    }
    return MatchType.none();
  }

  @Override
  public String toString() {
    return "Both[" + first + ", " + second + "]";
  }
}
