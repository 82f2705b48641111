package com.onkiup.linker.lexer;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;

import com.onkiup.linker.lexer.util.LoggerLayout;
import com.onkiup.linker.lexer.util.SourceBuffer;

/**
 * Incremental lexer that splits its buffer into lexemes using a {@link Rule} tree.
 * <p>
 * Every {@link #step()} grows the current window by one code point and tests it against the rule.
 * A full match consumes the window and yields the extracted value (if any); the next window starts right after it.
 * Partial matches and non-matches yield nothing and leave the window start in place.
 * <p>
 * As an {@link Iterator}, a lexer is a single-pass sequence of optional tokens that can only be restarted with {@link #reset(CharSequence)}.
 * Instances are not thread-safe; rule trees can be shared between lexers.
 * @param <X> token type
 */
public class Lexer<X> implements Iterator<Optional<X>> {

  private final Rule<X> rule;
  private final LexerConfig config;
  private CharSequence buffer;
  private int start, end;
  private SourceLocation location;
  private boolean trailingReported;

  public Lexer(Rule<X> rule) {
    this(rule, "");
  }

  public Lexer(Rule<X> rule, CharSequence buffer) {
    this(rule, buffer, LexerConfig.DEFAULT);
  }

  public Lexer(Rule<X> rule, CharSequence buffer, LexerConfig config) {
    this.rule = Objects.requireNonNull(rule, "rule");
    this.config = Objects.requireNonNull(config, "config");
    reset(buffer);
  }

  /**
   * Rebinds this lexer to a new buffer and moves the window to its start
   * @param buffer text to tokenize, copied unless it is a {@link SourceBuffer}; {@link SourceBuffer} names are used in reported locations
   */
  public void reset(CharSequence buffer) {
    Objects.requireNonNull(buffer, "buffer");
    this.buffer = buffer instanceof SourceBuffer ? buffer : buffer.toString();
    this.start = 0;
    this.end = 0;
    String name = buffer instanceof SourceBuffer ? ((SourceBuffer) buffer).name() : config.name();
    this.location = new SourceLocation(name, 0, 0, 0);
    this.trailingReported = false;
    log("Reset to {} characters of '{}'", buffer.length(), name);
  }

  /**
   * Grows the window by one code point and tests it against the rule
   * @return extracted token value, or empty if no token was produced by this step
   * @throws LexerError when the buffer is exhausted
   */
  public Optional<X> step() {
    if (end >= buffer.length()) {
      throw exhausted();
    }

    end = Character.offsetByCodePoints(buffer, end, 1);
    CharSequence window = window();
    if (logger().isDebugEnabled()) {
      log("Window [{}, {}): '{}'", start, end, LoggerLayout.sanitize(window));
    }

    MatchResult<X> result = rule.matches(window);
    if (!result.isMatch()) {
      return Optional.empty();
    }

    if (logger().isDebugEnabled()) {
      log("Lexeme at {}: '{}' -> {}", location, LoggerLayout.sanitize(window), result);
    }
    location = location.advance(window);
    start = end;
    return result.value();
  }

  /**
   * @return true while there is input left to grow the window over
   * @throws LexerError of kind {@link LexerError.Kind#UNRECOGNIZED_TOKEN} in strict mode when input ends with unrecognized text
   */
  @Override
  public boolean hasNext() {
    if (end < buffer.length()) {
      return true;
    }

    if (exhaustedKind() == LexerError.Kind.UNRECOGNIZED_TOKEN) {
      throw exhausted();
    }
    reportTrailingInput();
    return false;
  }

  @Override
  public Optional<X> next() {
    if (!hasNext()) {
      throw new NoSuchElementException("End of input at " + location);
    }
    return step();
  }

  /**
   * @return a lazy stream of tokens produced by the rest of the input
   */
  public Stream<X> tokens() {
    Spliterator<Optional<X>> spliterator = Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL);
    return StreamSupport.stream(spliterator, false)
        .filter(Optional::isPresent)
        .map(Optional::get);
  }

  public Rule<X> rule() {
    return rule;
  }

  public LexerConfig config() {
    return config;
  }

  /**
   * @return offset of the current window start
   */
  public int start() {
    return start;
  }

  /**
   * @return offset immediately after the current window
   */
  public int end() {
    return end;
  }

  /**
   * @return text of the current window
   */
  public CharSequence window() {
    return buffer.subSequence(start, end);
  }

  /**
   * @return all text the window has grown over so far
   */
  public CharSequence scanned() {
    return buffer.subSequence(0, end);
  }

  /**
   * @return text that has not been consumed by any lexeme yet
   */
  public CharSequence remaining() {
    return buffer.subSequence(start, buffer.length());
  }

  /**
   * @return location of the current window start
   */
  public SourceLocation location() {
    return location;
  }

  public Logger logger() {
    return config.logger();
  }

  /**
   * Logs a DEBUG-level message from this lexer
   * @param message message template
   * @param arguments template arguments
   */
  protected void log(CharSequence message, Object... arguments) {
    logger().debug(message.toString(), arguments);
  }

  private LexerError.Kind exhaustedKind() {
    if (config.strict() && start < buffer.length()) {
      return LexerError.Kind.UNRECOGNIZED_TOKEN;
    }
    return LexerError.Kind.END_OF_INPUT;
  }

  /**
   * Warns (once per buffer) about trailing input that no rule recognized
   */
  private void reportTrailingInput() {
    if (trailingReported || start >= buffer.length()) {
      return;
    }
    trailingReported = true;
    logger().warn("Dropping unrecognized trailing input at {}: '{}'", location, LoggerLayout.sanitize(remaining()));
  }

  private LexerError exhausted() {
    LexerError.Kind kind = exhaustedKind();
    CharSequence trailing = remaining();
    if (kind == LexerError.Kind.UNRECOGNIZED_TOKEN) {
      return new LexerError(kind, "Unrecognized token", trailing, location);
    }

    reportTrailingInput();
    String message = trailing.length() == 0 ? "End of input" : "End of input with unrecognized trailing text";
    return new LexerError(kind, message, trailing, location);
  }
}
