package org.robincores.vril.json;

import org.robincores.vril.ConversionException;

// Interchange input is not a well-formed program
public class DecodeException extends ConversionException {
  public DecodeException(String reason) {
    super(reason, 0, 0);
  }

  public DecodeException(String reason, Throwable cause) {
    super(reason, cause);
  }
}
