package com.onkiup.linker.lexer.rule;

import java.util.Optional;

import org.junit.Test;
import org.mockito.Mockito;

import com.onkiup.linker.lexer.MatchType;
import com.onkiup.linker.lexer.Rule;

import static org.junit.Assert.*;

public class EitherRuleTest {

  @Test
  public void testDeferral() {
    Rule<Object> subject = Rule.either(Rule.literal("function"), Rule.literal("func"));

    assertTrue(Rule.literal("func").matches("func").isMatch());
    assertTrue(subject.matches("func").isPartial());
    assertTrue(subject.matches("fun").isPartial());
    assertTrue(subject.matches("function").isMatch());
    assertTrue(subject.matches("functions").isNone());
  }

  @Test
  public void testFallback() {
    Rule<Object> subject = Rule.either(Rule.literal("a"), Rule.literal("bc"));

    assertTrue(subject.matches("a").isMatch());
    assertTrue(subject.matches("b").isPartial());
    assertTrue(subject.matches("bc").isMatch());
    assertTrue(subject.matches("x").isNone());
  }

  @Test
  public void testValues() {
    Rule<String> subject = Rule.either(
        Rule.value(Rule.literal("a"), window -> "A"),
        Rule.value(Rule.literal("b"), window -> "B"));

    assertEquals(Optional.of("A"), subject.matches("a").value());
    assertEquals(Optional.of("B"), subject.matches("b").value());
  }

  @Test
  public void testSecondRuleIsSkippedWhileFirstIsPartial() {
    Rule<Object> second = Mockito.mock(Rule.class);
    Mockito.when(second.matches(Mockito.any())).thenReturn(MatchType.match());
    Rule<Object> subject = Rule.either(Rule.literal("function"), second);

    assertTrue(subject.matches("fun").isPartial());
    Mockito.verifyNoInteractions(second);

    assertTrue(subject.matches("x").isMatch());
    Mockito.verify(second).matches("x");
  }
}
