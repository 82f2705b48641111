package com.onkiup.linker.lexer;

import com.onkiup.linker.lexer.util.LoggerLayout;

public class EvaluationError extends RuntimeException {

  public EvaluationError(Rule<?> rule, CharSequence window, Exception cause) {
    super("Failed to extract value from '" + LoggerLayout.sanitize(window) + "' matched by " + rule, cause);
  }
}
