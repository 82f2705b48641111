package com.onkiup.linker.lexer;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.onkiup.linker.lexer.util.LoggerLayout;

/**
 * Position of a lexeme in lexer input
 */
public class SourceLocation {

  private static final Logger logger = LoggerFactory.getLogger(SourceLocation.class);

  private final int line, column, position;
  private final String name;

  public static SourceLocation endOf(String name, CharSequence text) {
    return new SourceLocation(name, 0, 0, 0).advance(text);
  }

  public SourceLocation(String name, int position, int line, int column) {
    if (position < 0) {
      throw new IllegalArgumentException("Position cannot be negative");
    }

    if (line < 0) {
      throw new IllegalArgumentException("Line cannot be negative");
    }

    if (column < 0) {
      throw new IllegalArgumentException("Column cannot be negative");
    }

    this.name = name;
    this.position = position;
    this.line = line;
    this.column = column;
  }

  public String name() {
    return name;
  }

  /**
   * @return offset (in UTF-16 units) from the start of the input
   */
  public int position() {
    return position;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  /**
   * @param source text that follows this location
   * @return location immediately after the given text
   */
  public SourceLocation advance(CharSequence source) {
    int position = this.position + source.length();
    int line = this.line;
    int column = this.column;
    for (int i = 0; i < source.length(); i++) {
      char character = source.charAt(i);
      if (character == '\n') {
        line++;
        column = 0;
      } else if (!Character.isLowSurrogate(character)) {
        column++;
      }
    }

    SourceLocation result = new SourceLocation(name, position, line, column);
    logger.trace("Advanced from {} to {} using chars: '{}'", this, result, LoggerLayout.sanitize(source));
    return result;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof SourceLocation)) {
      return false;
    }
    SourceLocation that = (SourceLocation) other;
    return position == that.position && line == that.line && column == that.column
        && Objects.equals(name, that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, position, line, column);
  }

  @Override
  public String toString() {
    return new StringBuilder()
      .append(name)
      .append(" - ")
      .append(line)
      .append(':')
      .append(column)
      .toString();
  }
}
