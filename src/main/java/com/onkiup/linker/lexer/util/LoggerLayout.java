package com.onkiup.linker.lexer.util;

import java.util.Objects;
import java.util.function.Supplier;

import org.apache.log4j.Layout;
import org.apache.log4j.spi.LoggingEvent;

/**
 * Log4j layout that prefixes every message with the tail of the text scanned so far
 */
public class LoggerLayout extends Layout {

  private static final int CONTEXT_WIDTH = 48;

  private final Layout parent;
  private final Supplier<CharSequence> scanned;

  /**
   * @param parent layout to delegate log4j settings to
   * @param scanned supplier of the text scanned so far, usually {@code lexer::scanned}
   */
  public LoggerLayout(Layout parent, Supplier<CharSequence> scanned) {
    this.parent = Objects.requireNonNull(parent, "parent");
    this.scanned = Objects.requireNonNull(scanned, "scanned");
  }

  @Override
  public String format(LoggingEvent event) {
    CharSequence text = scanned.get();
    if (text == null) {
      text = "";
    }
    CharSequence tail = text.subSequence(Math.max(0, text.length() - CONTEXT_WIDTH), text.length());
    String context = String.format("'%s'", ralign(sanitize(tail), CONTEXT_WIDTH));
    return String.format("%50.50s || %s :: %s\n", context, ralign(event.getLoggerName(), 50), event.getRenderedMessage());
  }

  @Override
  public boolean ignoresThrowable() {
    return parent.ignoresThrowable();
  }

  @Override
  public void activateOptions() {
    parent.activateOptions();
  }

  public Layout parent() {
    return parent;
  }

  public static String sanitize(Object what) {
    return what == null ? "null" : sanitize(what.toString());
  }

  /**
   * @return given text with line breaks and tabs escaped
   */
  public static String sanitize(String what) {
    return what == null ? null : what.replace("\r", "\\r").replace("\n", "\\n").replace("\t", "\\t");
  }

  /**
   * Right-aligns text to given width, cutting off its head when it does not fit
   */
  public static String ralign(CharSequence what, int len) {
    if (what.length() >= len) {
      return what.subSequence(what.length() - len, what.length()).toString();
    }
    String format = String.format("%%%1$d.%1$ds%%2$s", len - what.length());
    return String.format(format, "", what);
  }
}
