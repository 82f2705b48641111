package com.onkiup.linker.lexer;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

import com.onkiup.linker.lexer.rule.AllRule;
import com.onkiup.linker.lexer.rule.AnyRule;
import com.onkiup.linker.lexer.rule.BothRule;
import com.onkiup.linker.lexer.rule.CharacterClass;
import com.onkiup.linker.lexer.rule.CharacterClassRule;
import com.onkiup.linker.lexer.rule.EitherRule;
import com.onkiup.linker.lexer.rule.EndsWithRule;
import com.onkiup.linker.lexer.rule.IgnoreRule;
import com.onkiup.linker.lexer.rule.LiteralRule;
import com.onkiup.linker.lexer.rule.NotRule;
import com.onkiup.linker.lexer.rule.OnlyRule;
import com.onkiup.linker.lexer.rule.ValueRule;

/**
 * Main interface for all lexical rules.
 * Rules are immutable and classify text windows without any side effects,
 * so a single rule tree can be shared between lexers running on different threads.
 * @param <X> the type of tokens produced by this rule
 */
@FunctionalInterface
public interface Rule<X> extends Function<CharSequence, MatchResult<X>> {

  /**
   * Classifies given text window
   * @param window text to test
   * @return match classification, never null
   */
  MatchResult<X> matches(CharSequence window);

  @Override
  default MatchResult<X> apply(CharSequence window) {
    return matches(window);
  }

  /**
   * @return a rule that fully matches exactly the given text and partially matches its prefixes
   */
  static <X> Rule<X> literal(String text) {
    return new LiteralRule<>(text, false);
  }

  static <X> Rule<X> literal(String text, boolean ignoreCase) {
    return new LiteralRule<>(text, ignoreCase);
  }

  static <X> Rule<X> numeric() {
    return new CharacterClassRule<>(CharacterClass.NUMERIC);
  }

  static <X> Rule<X> alphabetic() {
    return new CharacterClassRule<>(CharacterClass.ALPHABETIC);
  }

  static <X> Rule<X> whitespace() {
    return new CharacterClassRule<>(CharacterClass.WHITESPACE);
  }

  static <X> Rule<X> endsWith(String suffix) {
    return new EndsWithRule<>(suffix);
  }

  /**
   * @return a rule that matches like the given one and extracts a value from the whole matched window
   */
  static <X> Rule<X> value(Rule<?> rule, Extractor<X> extractor) {
    return new ValueRule<>(rule, extractor);
  }

  /**
   * @return a rule that matches like the given one but never produces a value
   */
  static <X> Rule<X> ignore(Rule<?> rule) {
    return new IgnoreRule<>(rule);
  }

  static <X> Rule<X> not(Rule<?> rule) {
    return new NotRule<>(rule);
  }

  static <X> Rule<X> only(Rule<X> rule) {
    return new OnlyRule<>(rule);
  }

  static <X> Rule<X> both(Rule<?> first, Rule<?> second) {
    return new BothRule<>(first, second);
  }

  static <X> Rule<X> either(Rule<X> first, Rule<X> second) {
    return new EitherRule<>(first, second);
  }

  static <X> Rule<X> all(Extractor<X> extractor, Rule<?>... rules) {
    return new AllRule<>(Arrays.asList(rules), extractor);
  }

  static <X> Rule<X> all(List<? extends Rule<?>> rules, Extractor<X> extractor) {
    return new AllRule<>(rules, extractor);
  }

  @SafeVarargs
  static <X> Rule<X> any(Rule<X>... rules) {
    return new AnyRule<>(Arrays.asList(rules));
  }

  static <X> Rule<X> any(List<? extends Rule<X>> rules) {
    return new AnyRule<>(rules);
  }
}
