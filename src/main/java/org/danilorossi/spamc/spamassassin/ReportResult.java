package org.danilorossi.spamc.spamassassin;

import lombok.Builder;
import lombok.Value;
import org.danilorossi.spamc.protocol.Response;

/** Outcome of REPORT and REPORT_IFSPAM. The report is empty when spamd sent none (ham). */
@Value
@Builder
public class ReportResult {
  boolean isSpam;
  double score;
  double threshold;
  String report;
  Response response;

  public boolean hasReport() {
    return !report.isEmpty();
  }
}
