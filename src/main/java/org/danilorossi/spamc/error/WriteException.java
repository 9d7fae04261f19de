package org.danilorossi.spamc.error;

import lombok.Getter;

/** Sending the request failed after {@link #getBytesWritten()} bytes had been accepted. */
public class WriteException extends TransportException {

  @Getter private final long bytesWritten;

  public WriteException(final String message, final long bytesWritten, final Throwable cause) {
    super(message, cause);
    this.bytesWritten = bytesWritten;
  }
}
