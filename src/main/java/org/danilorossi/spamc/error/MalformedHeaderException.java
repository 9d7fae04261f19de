package org.danilorossi.spamc.error;

public class MalformedHeaderException extends MalformedResponseException {

  public MalformedHeaderException(final String message) {
    super(message);
  }

  public MalformedHeaderException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
