package org.danilorossi.spamc.error;

/** The caller cancelled the exchange; the connection was closed underneath the I/O. */
public class ExchangeCancelledException extends TransportException {

  public ExchangeCancelledException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
