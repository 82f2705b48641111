package com.onkiup.linker.lexer.rule;

import java.util.Objects;

import com.onkiup.linker.lexer.MatchResult;
import com.onkiup.linker.lexer.Rule;

/**
 * Matches like the wrapped rule but discards whatever value it extracts,
 * so lexers consume matched text without emitting a token
 */
public class IgnoreRule<X> implements Rule<X> {

  private final Rule<?> rule;

  public IgnoreRule(Rule<?> rule) {
    this.rule = Objects.requireNonNull(rule, "rule");
  }

  @Override
  public MatchResult<X> matches(CharSequence window) {
    return rule.matches(window).withoutValue();
  }

  @Override
  public String toString() {
    return "Ignore[" + rule + "]";
  }
}
