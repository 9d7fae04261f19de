package org.danilorossi.spamc.error;

/**
 * I/O failure in the middle of an exchange. The connection that raised it is always discarded.
 */
public class TransportException extends SpamcException {

  public TransportException(final String message) {
    super(message);
  }

  public TransportException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
