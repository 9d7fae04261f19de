package org.danilorossi.spamc.error;

/**
 * The daemon output could not be parsed. Distinct from I/O failures: the bytes arrived, they just
 * do not follow the SPAMD framing.
 */
public class MalformedResponseException extends SpamcException {

  public MalformedResponseException(final String message) {
    super(message);
  }

  public MalformedResponseException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
