package org.danilorossi.spamc.spamassassin;

import lombok.Builder;
import lombok.Value;
import org.danilorossi.spamc.protocol.ActionOption;
import org.danilorossi.spamc.protocol.Response;

/** Databases spamd actually updated; {@link ActionOption#NONE} when a header was absent. */
@Value
@Builder
public class TellResult {
  ActionOption didSet;
  ActionOption didRemove;
  Response response;
}
