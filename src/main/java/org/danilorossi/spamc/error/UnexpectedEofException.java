package org.danilorossi.spamc.error;

/** The daemon closed the connection before the response was complete. */
public class UnexpectedEofException extends TransportException {

  public UnexpectedEofException(final String message) {
    super(message);
  }
}
