package com.onkiup.linker.lexer.rule;

import java.util.Objects;

import com.onkiup.linker.lexer.MatchResult;
import com.onkiup.linker.lexer.MatchType;
import com.onkiup.linker.lexer.Rule;

/**
 * Matches windows that consist only of characters from the given class.
 * Never reports partial matches.
 */
public class CharacterClassRule<X> implements Rule<X> {

  private final CharacterClass characterClass;

  public CharacterClassRule(CharacterClass characterClass) {
    this.characterClass = Objects.requireNonNull(characterClass, "characterClass");
  }

  @Override
  public MatchResult<X> matches(CharSequence window) {
    return characterClass.containsAll(window) ? MatchType.match() : MatchType.none();
  }

  public CharacterClass characterClass() {
    return characterClass;
  }

  @Override
  public String toString() {
    switch (characterClass) {
      case NUMERIC:
        return "Numeric";
      case ALPHABETIC:
        return "Alphabetic";
      default:
        return "Whitespace";
    }
  }
}
