package com.onkiup.linker.lexer.rule;

import java.util.Objects;

import com.onkiup.linker.lexer.MatchResult;
import com.onkiup.linker.lexer.MatchType;
import com.onkiup.linker.lexer.Rule;

public class EndsWithRule<X> implements Rule<X> {

  private final String suffix;

  public EndsWithRule(String suffix) {
    this.suffix = Objects.requireNonNull(suffix, "suffix");
  }

  @Override
  public MatchResult<X> matches(CharSequence window) {
    return window.toString().endsWith(suffix) ? MatchType.match() : MatchType.none();
  }

  @Override
  public String toString() {
    return "EndsWith[" + suffix + "]";
  }
}
