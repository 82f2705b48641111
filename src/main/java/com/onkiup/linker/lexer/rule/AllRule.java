package com.onkiup.linker.lexer.rule;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.onkiup.linker.lexer.Extractor;
import com.onkiup.linker.lexer.MatchResult;
import com.onkiup.linker.lexer.MatchType;
import com.onkiup.linker.lexer.Rule;

/**
 * Ordered conjunction over a sequence of rules.
 * The first rule that does not fully match the window decides the result;
 * when all of them match, the extractor is applied once to the whole window.
 */
public class AllRule<X> implements Rule<X> {

  private final ImmutableList<Rule<?>> rules;
  private final Extractor<X> extractor;

  public AllRule(List<? extends Rule<?>> rules, Extractor<X> extractor) {
    this.rules = ImmutableList.copyOf(rules);
    this.extractor = Objects.requireNonNull(extractor, "extractor");
  }

  @Override
  public MatchResult<X> matches(CharSequence window) {
    for (Rule<?> rule : rules) {
      MatchResult<?> result = rule.matches(window);
      if (!result.isMatch()) {
        return result.withoutValue();
      }
    }

    return MatchType.match(extractor.extract(this, window));
  }

  @VisibleForTesting
  List<Rule<?>> rules() {
    return rules;
  }

  @Override
  public String toString() {
    return rules.stream()
        .map(Object::toString)
        .collect(Collectors.joining(", ", "All[", "]"));
  }
}
