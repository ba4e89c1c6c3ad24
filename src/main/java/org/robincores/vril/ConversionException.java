package org.robincores.vril;

/**
 * Fatal failure of a single conversion, in either direction. Nothing partial
 * is ever returned alongside it.
 */
public class ConversionException extends RuntimeException {
  private final String reason;
  private final int line;
  private final int column;

  public ConversionException(String reason, int line, int column) {
    super(line > 0 ? reason + " at line " + line + ", column " + column : reason);
    this.reason = reason;
    this.line = line;
    this.column = column;
  }

  public ConversionException(String reason, Throwable cause) {
    super(reason, cause);
    this.reason = reason;
    this.line = 0;
    this.column = 0;
  }

  // Message without the position suffix
  public String reason() {
    return reason;
  }

  // 1-based; 0 when no source position applies
  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  public boolean hasPosition() {
    return line > 0;
  }
}
