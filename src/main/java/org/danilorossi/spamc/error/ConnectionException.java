package org.danilorossi.spamc.error;

/** The transport could not be established (refused, timeout, unresolved host, TLS failure). */
public class ConnectionException extends SpamcException {

  public ConnectionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
