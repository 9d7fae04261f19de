package org.danilorossi.spamc.spamassassin;

import java.nio.charset.StandardCharsets;
import lombok.Builder;
import lombok.Value;
import org.danilorossi.spamc.protocol.Response;
import org.danilorossi.spamc.protocol.ScoreLine;

/**
 * Outcome of PROCESS (full rewritten message) and HEADERS (rewritten headers only). {@code score}
 * is null when spamd sent no Spam header.
 */
@Value
@Builder
public class ProcessResult {
  ScoreLine score;
  byte[] message;
  Response response;

  public String messageAsString() {
    return new String(message, StandardCharsets.UTF_8);
  }
}
