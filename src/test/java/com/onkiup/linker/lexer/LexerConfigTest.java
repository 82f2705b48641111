package com.onkiup.linker.lexer;

import java.util.Properties;

import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.Assert.*;

public class LexerConfigTest {

  @Test
  public void testDefaults() {
    assertEquals("unknown", LexerConfig.DEFAULT.name());
    assertFalse(LexerConfig.DEFAULT.strict());
    assertEquals(Lexer.class.getName(), LexerConfig.DEFAULT.logger().getName());
  }

  @Test
  public void testCopies() {
    Logger logger = LoggerFactory.getLogger("custom");
    LexerConfig config = LexerConfig.DEFAULT.withName("script").withStrict(true).withLogger(logger);

    assertEquals("script", config.name());
    assertTrue(config.strict());
    assertSame(logger, config.logger());
    assertEquals("unknown", LexerConfig.DEFAULT.name());
    assertEquals("LexerConfig[name=script, strict=true, logger=custom]", config.toString());
  }

  @Test
  public void testFromProperties() {
    Properties properties = new Properties();
    properties.setProperty(LexerConfig.NAME_PROPERTY, "props");
    properties.setProperty(LexerConfig.STRICT_PROPERTY, "true");

    LexerConfig config = LexerConfig.fromProperties(properties);
    assertEquals("props", config.name());
    assertTrue(config.strict());

    LexerConfig defaults = LexerConfig.fromProperties(new Properties());
    assertEquals("unknown", defaults.name());
    assertFalse(defaults.strict());
  }
}
