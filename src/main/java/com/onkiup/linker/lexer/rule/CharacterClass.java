package com.onkiup.linker.lexer.rule;

import java.util.function.IntPredicate;

/**
 * Unicode code point classes recognized by {@link CharacterClassRule}
 */
public enum CharacterClass implements IntPredicate {
  /**
   * Decimal digits, letter numbers (like roman numerals) and other numeric characters
   */
  NUMERIC {
    @Override
    public boolean test(int codePoint) {
      int type = Character.getType(codePoint);
      return type == Character.DECIMAL_DIGIT_NUMBER
          || type == Character.LETTER_NUMBER
          || type == Character.OTHER_NUMBER;
    }
  },
  ALPHABETIC {
    @Override
    public boolean test(int codePoint) {
      return Character.isAlphabetic(codePoint);
    }
  },
  /**
   * Java whitespace plus Unicode space separators (including no-break spaces)
   */
  WHITESPACE {
    @Override
    public boolean test(int codePoint) {
      return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
    }
  };

  /**
   * @return true if every code point of the given text belongs to this class (vacuously true for empty text)
   */
  public boolean containsAll(CharSequence text) {
    return text.codePoints().allMatch(this);
  }
}
