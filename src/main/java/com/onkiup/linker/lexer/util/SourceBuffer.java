package com.onkiup.linker.lexer.util;

import java.io.IOException;
import java.io.Reader;
import java.util.Objects;

/**
 * Named lexer input that is read into memory in full upon creation
 */
public class SourceBuffer implements CharSequence {

  private final StringBuilder buffer = new StringBuilder();
  private final String name;

  public SourceBuffer(String name, Reader reader) throws IOException {
    this.name = Objects.requireNonNull(name, "name");
    char[] chunk = new char[4096];
    for (int read = reader.read(chunk); read > -1; read = reader.read(chunk)) {
      buffer.append(chunk, 0, read);
    }
  }

  public SourceBuffer(String name, CharSequence text) {
    this.name = Objects.requireNonNull(name, "name");
    buffer.append(text);
  }

  public String name() {
    return name;
  }

  @Override
  public int length() {
    return buffer.length();
  }

  @Override
  public char charAt(int index) {
    return buffer.charAt(index);
  }

  @Override
  public CharSequence subSequence(int start, int end) {
    return buffer.subSequence(start, end);
  }

  @Override
  public String toString() {
    return buffer.toString();
  }
}
