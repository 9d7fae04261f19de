package org.danilorossi.spamc.error;

/** Header value with CR or LF, which would let a caller inject extra protocol lines. */
public class InvalidHeaderValueException extends InvalidRequestException {

  public InvalidHeaderValueException(final String message) {
    super(message);
  }
}
