package org.danilorossi.spamc.error;

import lombok.Getter;

public class MalformedStatusLineException extends MalformedResponseException {

  @Getter private final String line;

  public MalformedStatusLineException(final String message, final String line) {
    super(message + ": '" + line + "'");
    this.line = line;
  }
}
