package com.onkiup.linker.lexer.rule;

import java.util.Optional;

import org.junit.Test;

import com.onkiup.linker.lexer.Rule;

import static org.junit.Assert.*;

public class OnlyRuleTest {

  @Test
  public void testDelegation() {
    Rule<Integer> inner = Rule.value(Rule.literal("one"), window -> 1);
    Rule<Integer> subject = Rule.only(inner);

    for (String window : new String[] {"", "o", "on", "one", "ones", "x"}) {
      assertEquals(window, inner.matches(window), subject.matches(window));
    }
    assertEquals(Optional.of(1), subject.matches("one").value());
  }
}
