package org.danilorossi.spamc.error;

/** An explicit header contradicts a header the encoder computes (Content-length, Compress). */
public class EncodeException extends InvalidRequestException {

  public EncodeException(final String message) {
    super(message);
  }
}
