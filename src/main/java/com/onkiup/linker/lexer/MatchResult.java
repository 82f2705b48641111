package com.onkiup.linker.lexer;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of matching a single rule against a single text window
 * @param <X> the type of extracted values
 */
public final class MatchResult<X> {
  private final MatchType type;
  private final X value;

  MatchResult(MatchType type, X value) {
    this.type = Objects.requireNonNull(type, "type");
    this.value = type == MatchType.MATCH ? value : null;
  }

  public MatchType getType() {
    return type;
  }

  /**
   * @return the value extracted by the matched rule, empty for non-extracting rules and for non-matches
   */
  public Optional<X> value() {
    return Optional.ofNullable(value);
  }

  public boolean isNone() {
    return type == MatchType.NONE;
  }

  public boolean isPartial() {
    return type == MatchType.PARTIAL;
  }

  public boolean isMatch() {
    return type == MatchType.MATCH;
  }

  /**
   * @return a result of the same type that carries no value
   */
  public <Y> MatchResult<Y> withoutValue() {
    return type.result(null);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof MatchResult)) {
      return false;
    }
    MatchResult<?> that = (MatchResult<?>) other;
    return type == that.type && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value);
  }

  @Override
  public String toString() {
    return value == null ? "MatchResult: " + type : "MatchResult: " + type + " (" + value + ")";
  }
}
