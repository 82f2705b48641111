package com.onkiup.linker.lexer;

import java.util.Objects;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable lexer settings
 */
public final class LexerConfig {

  public static final String NAME_PROPERTY = "linker.lexer.name";
  public static final String STRICT_PROPERTY = "linker.lexer.strict";

  public static final LexerConfig DEFAULT = new LexerConfig("unknown", false, LoggerFactory.getLogger(Lexer.class));

  private final String name;
  private final boolean strict;
  private final Logger logger;

  private LexerConfig(String name, boolean strict, Logger logger) {
    this.name = Objects.requireNonNull(name, "name");
    this.strict = strict;
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  /**
   * Reads lexer settings from {@value #NAME_PROPERTY} and {@value #STRICT_PROPERTY} properties;
   * missing properties keep their default values
   */
  public static LexerConfig fromProperties(Properties properties) {
    return DEFAULT
        .withName(properties.getProperty(NAME_PROPERTY, DEFAULT.name))
        .withStrict(Boolean.parseBoolean(properties.getProperty(STRICT_PROPERTY, String.valueOf(DEFAULT.strict))));
  }

  /**
   * @return input name reported in {@link SourceLocation}s
   */
  public String name() {
    return name;
  }

  /**
   * @return true if trailing input that no rule recognized should be reported as {@link LexerError.Kind#UNRECOGNIZED_TOKEN}
   */
  public boolean strict() {
    return strict;
  }

  public Logger logger() {
    return logger;
  }

  public LexerConfig withName(String name) {
    return new LexerConfig(name, strict, logger);
  }

  public LexerConfig withStrict(boolean strict) {
    return new LexerConfig(name, strict, logger);
  }

  public LexerConfig withLogger(Logger logger) {
    return new LexerConfig(name, strict, logger);
  }

  @Override
  public String toString() {
    return "LexerConfig[name=" + name + ", strict=" + strict + ", logger=" + logger.getName() + "]";
  }
}
