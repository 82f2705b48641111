package com.onkiup.linker.lexer.rule;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.onkiup.linker.lexer.MatchResult;
import com.onkiup.linker.lexer.MatchType;
import com.onkiup.linker.lexer.Rule;
import com.onkiup.linker.lexer.util.LoggerLayout;

/**
 * First-match-wins disjunction with longest-match bias.
 * <p>
 * Alternatives are tested in order. A full match is accepted only if none of the
 * alternatives listed before it partially matches the window; otherwise it is dropped
 * and the remaining alternatives are tested. This rule never reports a partial match:
 * the lexer keeps growing the window whenever there is no accepted full match.
 */
public class AnyRule<X> implements Rule<X> {

  private static final Logger logger = LoggerFactory.getLogger(AnyRule.class);

  private final ImmutableList<Rule<X>> rules;

  public AnyRule(List<? extends Rule<X>> rules) {
    this.rules = ImmutableList.copyOf(rules);
  }

  @Override
  public MatchResult<X> matches(CharSequence window) {
    int partials = 0;

    for (Rule<X> rule : rules) {
      MatchResult<X> result = rule.matches(window);
      if (result.isPartial()) {
        partials++;
      } else if (result.isMatch()) {
        if (partials == 0) {
          return result;
        }
        if (logger.isTraceEnabled()) {
          logger.trace("Dropping match of {} on '{}': {} earlier alternative(s) still match partially",
              rule, LoggerLayout.sanitize(window), partials);
        }
      }
    }

    return MatchType.none();
  }

  @VisibleForTesting
  List<Rule<X>> rules() {
    return rules;
  }

  @Override
  public String toString() {
    return rules.stream()
        .map(Object::toString)
        .collect(Collectors.joining(", ", "Any[", "]"));
  }
}
