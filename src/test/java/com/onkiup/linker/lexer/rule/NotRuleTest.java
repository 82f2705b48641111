package com.onkiup.linker.lexer.rule;

import org.junit.Test;

import com.onkiup.linker.lexer.Rule;

import static org.junit.Assert.*;

public class NotRuleTest {

  @Test
  public void testNegation() {
    Rule<Object> subject = Rule.not(Rule.literal("end"));

    assertTrue(subject.matches("x").isMatch());
    assertTrue(subject.matches("ended").isMatch());
    assertTrue(subject.matches("end").isNone());
  }

  @Test
  public void testPartialMatchIsNotNegated() {
    Rule<Object> subject = Rule.not(Rule.literal("end"));

    assertTrue(subject.matches("en").isNone());
  }

  @Test
  public void testEmptyWindow() {
    assertTrue(Rule.not(Rule.numeric()).matches("").isNone());
    assertTrue(Rule.not(Rule.endsWith("s")).matches("").isMatch());
  }
}
