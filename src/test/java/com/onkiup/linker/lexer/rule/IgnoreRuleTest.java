package com.onkiup.linker.lexer.rule;

import org.junit.Test;

import com.onkiup.linker.lexer.MatchResult;
import com.onkiup.linker.lexer.Rule;

import static org.junit.Assert.*;

public class IgnoreRuleTest {

  @Test
  public void testClassification() {
    Rule<String> subject = Rule.ignore(Rule.literal("end"));

    assertTrue(subject.matches("en").isPartial());
    assertTrue(subject.matches("end").isMatch());
    assertTrue(subject.matches("ended").isNone());
  }

  @Test
  public void testDiscardsValues() {
    Rule<String> subject = Rule.ignore(Rule.value(Rule.whitespace(), window -> "SPACE"));

    MatchResult<String> result = subject.matches("  ");
    assertTrue(result.isMatch());
    assertFalse(result.value().isPresent());
  }
}
