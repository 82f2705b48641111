package com.onkiup.linker.lexer;

import java.util.function.Function;

/**
 * Converts a matched text window into a token value.
 * Extractors should not have side effects: lexer may invoke them several times for the same lexeme.
 * @param <X> token type
 */
@FunctionalInterface
public interface Extractor<X> extends Function<CharSequence, X> {

  /**
   * Applies this extractor to the window matched by the given rule
   * @param owner the rule that matched the window
   * @param window matched text
   * @return extracted value
   * @throws EvaluationError if the extractor fails
   */
  default X extract(Rule<?> owner, CharSequence window) {
    try {
      return apply(window);
    } catch (RuntimeException e) {
      throw new EvaluationError(owner, window, e);
    }
  }
}
