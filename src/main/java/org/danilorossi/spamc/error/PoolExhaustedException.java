package org.danilorossi.spamc.error;

/** Admission control rejected the exchange: every connection slot is in use. */
public class PoolExhaustedException extends SpamcException {

  public PoolExhaustedException(final String message) {
    super(message);
  }
}
