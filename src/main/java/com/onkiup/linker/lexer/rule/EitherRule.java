package com.onkiup.linker.lexer.rule;

import java.util.Objects;

import com.onkiup.linker.lexer.MatchResult;
import com.onkiup.linker.lexer.MatchType;
import com.onkiup.linker.lexer.Rule;

/**
 * Ordered disjunction of two rules.
 * While the first rule partially matches the window the second one is not consulted:
 * the first rule may still complete on a longer window and takes precedence.
 */
public class EitherRule<X> implements Rule<X> {

  private final Rule<X> first;
  private final Rule<X> second;

  public EitherRule(Rule<X> first, Rule<X> second) {
    this.first = Objects.requireNonNull(first, "first");
    this.second = Objects.requireNonNull(second, "second");
  }

  @Override
  public MatchResult<X> matches(CharSequence window) {
    MatchResult<X> result = first.matches(window);
    if (result.isMatch()) {
      return result;
    } else if (result.isPartial()) {
      return MatchType.partial();
    }

    result = second.matches(window);
    if (result.isMatch()) {
      return result;
    }
    return result.isPartial() ? MatchType.partial() : MatchType.none();
  }

  @Override
  public String toString() {
    return "Either[" + first + ", " + second + "]";
  }
}
