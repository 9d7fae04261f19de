package org.danilorossi.spamc.error;

/** Bytes received from a spamc client do not follow the SPAMC framing. */
public class MalformedRequestException extends SpamcException {

  public MalformedRequestException(final String message) {
    super(message);
  }

  public MalformedRequestException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
