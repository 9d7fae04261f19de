package org.danilorossi.spamc.spamassassin;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PingResult {
  String version;
  String message;
}
