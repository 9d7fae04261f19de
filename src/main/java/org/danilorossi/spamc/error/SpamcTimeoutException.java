package org.danilorossi.spamc.error;

/** The exchange deadline elapsed while writing, reading or waiting for a connection. */
public class SpamcTimeoutException extends TransportException {

  public SpamcTimeoutException(final String message) {
    super(message);
  }

  public SpamcTimeoutException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
