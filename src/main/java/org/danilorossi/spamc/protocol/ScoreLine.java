package org.danilorossi.spamc.protocol;

import lombok.Value;

/** Parsed value of the {@code Spam} header, e.g. {@code True ; 6.5 / 5.0}. */
@Value
public class ScoreLine {
  boolean isSpam;
  double score;
  double threshold;
}
