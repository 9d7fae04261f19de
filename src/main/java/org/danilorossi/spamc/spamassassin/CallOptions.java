package org.danilorossi.spamc.spamassassin;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;
import org.danilorossi.spamc.transport.Endpoint;

/** Per-call overrides of the client settings. Null fields fall back to the client's. */
@Value
@Builder
public class CallOptions {

  public static final CallOptions DEFAULTS = CallOptions.builder().build();

  Duration timeout;
  Endpoint endpoint;
  String user;
  Boolean compress;
}
