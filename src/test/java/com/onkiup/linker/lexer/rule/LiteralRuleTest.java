package com.onkiup.linker.lexer.rule;

import org.junit.Test;

import com.onkiup.linker.lexer.MatchType;
import com.onkiup.linker.lexer.Rule;

import static org.junit.Assert.*;

public class LiteralRuleTest {

  @Test
  public void testMatching() {
    Rule<Object> subject = Rule.literal("end");

    assertEquals(MatchType.PARTIAL, subject.matches("en").getType());
    assertEquals(MatchType.MATCH, subject.matches("end").getType());
    assertFalse(subject.matches("end").value().isPresent());
    assertEquals(MatchType.NONE, subject.matches("ended").getType());
  }

  @Test
  public void testPrefixes() {
    Rule<Object> subject = Rule.literal("end");

    assertTrue(subject.matches("").isPartial());
    assertTrue(subject.matches("e").isPartial());
    assertTrue(subject.matches("x").isNone());
    assertTrue(subject.matches("ex").isNone());
    assertTrue(subject.matches("End").isNone());
  }

  @Test
  public void testIgnoreCase() {
    Rule<Object> subject = Rule.literal("end", true);

    assertTrue(subject.matches("END").isMatch());
    assertTrue(subject.matches("eN").isPartial());
    assertTrue(subject.matches("eNds").isNone());

    // characters are compared by their lower case forms only
    assertTrue(Rule.literal("i", true).matches("I").isMatch());
    assertTrue(Rule.literal("i", true).matches("\u0131").isNone());
    assertTrue(Rule.literal("k", true).matches("\u212A").isMatch());
    assertTrue(Rule.literal("\u212A", true).matches("k").isMatch());
    assertTrue(Rule.literal("\u017F", true).matches("s").isNone());
  }

  @Test
  public void testSupplementaryCharacters() {
    String script = new String(Character.toChars(0x1D49C));
    Rule<Object> subject = Rule.literal(script + "x");

    assertTrue(subject.matches(script).isPartial());
    assertTrue(subject.matches(script + "x").isMatch());
    assertTrue(subject.matches(script.substring(0, 1) + "x").isNone());
  }

  @Test
  public void testEmptyLiteral() {
    Rule<Object> subject = Rule.literal("");

    assertTrue(subject.matches("").isMatch());
    assertTrue(subject.matches("a").isNone());
  }
}
