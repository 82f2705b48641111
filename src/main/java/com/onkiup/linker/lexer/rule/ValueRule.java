package com.onkiup.linker.lexer.rule;

import java.util.Objects;

import com.onkiup.linker.lexer.Extractor;
import com.onkiup.linker.lexer.MatchResult;
import com.onkiup.linker.lexer.MatchType;
import com.onkiup.linker.lexer.Rule;

/**
 * Wraps another rule with a value extractor.
 * The extractor receives the whole window, not the part matched by any nested rule.
 */
public class ValueRule<X> implements Rule<X> {

  private final Rule<?> rule;
  private final Extractor<X> extractor;

  public ValueRule(Rule<?> rule, Extractor<X> extractor) {
    this.rule = Objects.requireNonNull(rule, "rule");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
  }

  @Override
  public MatchResult<X> matches(CharSequence window) {
    MatchResult<?> result = rule.matches(window);
    if (result.isMatch()) {
      return MatchType.match(extractor.extract(this, window));
    }
    return result.withoutValue();
  }

  @Override
  public String toString() {
    return "Value[" + rule + "]";
  }
}
