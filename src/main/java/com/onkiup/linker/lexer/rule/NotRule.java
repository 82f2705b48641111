package com.onkiup.linker.lexer.rule;

import java.util.Objects;

import com.onkiup.linker.lexer.MatchResult;
import com.onkiup.linker.lexer.MatchType;
import com.onkiup.linker.lexer.Rule;

/**
 * Fully matches windows the wrapped rule rejects.
 * Partial matches of the wrapped rule are not negated into anything but {@link MatchType#NONE}.
 */
public class NotRule<X> implements Rule<X> {

  private final Rule<?> rule;

  public NotRule(Rule<?> rule) {
    this.rule = Objects.requireNonNull(rule, "rule");
  }

  @Override
  public MatchResult<X> matches(CharSequence window) {
    return rule.matches(window).isNone() ? MatchType.match() : MatchType.none();
  }

  @Override
  public String toString() {
    return "Not[" + rule + "]";
  }
}
