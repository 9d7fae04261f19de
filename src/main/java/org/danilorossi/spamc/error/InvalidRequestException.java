package org.danilorossi.spamc.error;

/** The caller built a request the protocol cannot carry. Never sent, never retried. */
public class InvalidRequestException extends IllegalArgumentException {

  public InvalidRequestException(final String message) {
    super(message);
  }
}
