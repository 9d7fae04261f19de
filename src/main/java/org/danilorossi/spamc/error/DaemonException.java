package org.danilorossi.spamc.error;

import java.util.Optional;
import lombok.Getter;
import org.danilorossi.spamc.protocol.Response;
import org.danilorossi.spamc.protocol.Status;

/**
 * Well-formed response whose status code is not {@code EX_OK}. The connection that carried it
 * was healthy and has already been released.
 */
public class DaemonException extends SpamcException {

  @Getter private final Response response;

  public DaemonException(final Response response) {
    super(
        "spamd returned non-OK: " + response.getStatusCode() + " " + response.getStatusMessage());
    this.response = response;
  }

  public int getStatusCode() {
    return response.getStatusCode();
  }

  public Optional<Status> getStatus() {
    return response.getStatus();
  }
}
