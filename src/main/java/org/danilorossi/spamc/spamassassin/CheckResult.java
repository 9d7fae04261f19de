package org.danilorossi.spamc.spamassassin;

import lombok.Builder;
import lombok.Value;
import org.danilorossi.spamc.protocol.Response;

@Value
@Builder
public class CheckResult {
  boolean isSpam;
  double score;
  double threshold;
  Response response;
}
