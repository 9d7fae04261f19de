package org.danilorossi.spamc.error;

import java.io.IOException;
import lombok.Getter;
import lombok.val;
import org.danilorossi.spamc.protocol.Command;

/**
 * Base of every checked failure raised by the client. Carries the command and the endpoint of the
 * exchange when they are known, so a failure can be diagnosed without retrying.
 */
@Getter
public class SpamcException extends IOException {

  private Command command;
  private String endpoint;

  public SpamcException(final String message) {
    super(message);
  }

  public SpamcException(final String message, final Throwable cause) {
    super(message, cause);
  }

  /**
   * Records the exchange context. Values already set are kept, so the innermost layer that knew
   * them wins.
   */
  public SpamcException attach(final Command command, final Object endpoint) {
    if (this.command == null) this.command = command;
    if (this.endpoint == null && endpoint != null) this.endpoint = endpoint.toString();
    return this;
  }

  @Override
  public String getMessage() {
    val base = super.getMessage();
    if (command == null && endpoint == null) return base;
    val sb = new StringBuilder(base == null ? "" : base).append(" [");
    if (command != null) sb.append("command=").append(command);
    if (command != null && endpoint != null) sb.append(", ");
    if (endpoint != null) sb.append("endpoint=").append(endpoint);
    return sb.append(']').toString();
  }
}
