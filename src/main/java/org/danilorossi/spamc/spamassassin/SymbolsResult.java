package org.danilorossi.spamc.spamassassin;

import java.util.List;
import lombok.Builder;
import lombok.Value;
import org.danilorossi.spamc.protocol.Response;

@Value
@Builder
public class SymbolsResult {
  boolean isSpam;
  double score;
  double threshold;
  /** Rule names that matched, in the order spamd listed them. */
  List<String> symbols;
  String symbolsRaw; // body as sent by spamd
  Response response;
}
