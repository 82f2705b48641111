package com.onkiup.linker.lexer;

import java.util.Objects;

import com.onkiup.linker.lexer.util.LoggerLayout;

/**
 * Raised by {@link Lexer#step()} when no further lexemes can be produced
 */
public class LexerError extends RuntimeException {

  public enum Kind {
    /**
     * No diagnostic context is available; never raised by {@link Lexer} itself
     */
    NO_SIGNAL,
    /**
     * Lexer input is exhausted
     */
    END_OF_INPUT,
    /**
     * Lexer input ended with text that no rule recognized
     */
    UNRECOGNIZED_TOKEN
  }

  private final Kind kind;
  private final CharSequence text;
  private final SourceLocation location;

  public LexerError(Kind kind, String message, CharSequence text, SourceLocation location) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.text = text == null ? "" : text;
    this.location = location;
  }

  public Kind kind() {
    return kind;
  }

  /**
   * @return input text that was left unconsumed when this error was raised
   */
  public CharSequence text() {
    return text;
  }

  public SourceLocation location() {
    return location;
  }

  @Override
  public String toString() {
    StringBuilder result = new StringBuilder("Lexer error (")
      .append(kind)
      .append(") at ")
      .append(location == null ? "<unknown>" : location)
      .append(": ")
      .append(getMessage());

    if (text.length() > 0) {
      result.append("\n\tUnconsumed: '")
        .append(LoggerLayout.sanitize(text))
        .append('\'');
    }
    return result.toString();
  }
}
