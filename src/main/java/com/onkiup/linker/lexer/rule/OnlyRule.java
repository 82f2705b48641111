package com.onkiup.linker.lexer.rule;

import java.util.Objects;

import com.onkiup.linker.lexer.MatchResult;
import com.onkiup.linker.lexer.Rule;

/**
 * Grouping rule, classifies windows exactly like the wrapped rule
 */
public class OnlyRule<X> implements Rule<X> {

  private final Rule<X> rule;

  public OnlyRule(Rule<X> rule) {
    this.rule = Objects.requireNonNull(rule, "rule");
  }

  @Override
  public MatchResult<X> matches(CharSequence window) {
    return rule.matches(window);
  }

  @Override
  public String toString() {
    return "Only[" + rule + "]";
  }
}
