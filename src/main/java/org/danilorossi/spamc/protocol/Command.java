package org.danilorossi.spamc.protocol;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
public enum Command {
  CHECK("CHECK"),
  SYMBOLS("SYMBOLS"),
  REPORT("REPORT"),
  REPORT_IFSPAM("REPORT_IFSPAM"),
  PROCESS("PROCESS"),
  HEADERS("HEADERS"),
  PING("PING"),
  TELL("TELL");

  @Getter private final String verb;

  /** Whether the request must carry a message body. */
  public boolean requiresBody() {
    return switch (this) {
      case CHECK, SYMBOLS, REPORT, REPORT_IFSPAM, PROCESS, HEADERS, TELL -> true;
      case PING -> false;
    };
  }

  /** Whether spamd answers with a body (symbols, report, rewritten message). */
  public boolean responseHasBody() {
    return switch (this) {
      case SYMBOLS, REPORT, REPORT_IFSPAM, PROCESS, HEADERS -> true;
      case CHECK, PING, TELL -> false;
    };
  }

  public static Command fromVerb(final String verb) {
    if (verb == null) return null;
    for (Command c : values()) if (c.verb.equalsIgnoreCase(verb.trim())) return c;
    return null;
  }
}
