package org.danilorossi.spamc.protocol;

import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** Status codes spamd puts on the response line; they follow sysexits.h. */
@Getter
@AllArgsConstructor
public enum Status {
  EX_OK(0, "No problems were encountered"),
  EX_USAGE(64, "Command line usage error"),
  EX_DATAERR(65, "Data format error"),
  EX_NOINPUT(66, "Cannot open input"),
  EX_NOUSER(67, "Addressee unknown"),
  EX_NOHOST(68, "Host name unknown"),
  EX_UNAVAILABLE(69, "Service unavailable"),
  EX_SOFTWARE(70, "Internal software error"),
  EX_OSERR(71, "System error"),
  EX_OSFILE(72, "Critical operating system file missing"),
  EX_CANTCREAT(73, "Can't create (user) output file"),
  EX_IOERR(74, "Input/output error"),
  EX_TEMPFAIL(75, "Temporary failure, user is invited to retry"),
  EX_PROTOCOL(76, "Remote error in protocol"),
  EX_NOPERM(77, "Permission denied"),
  EX_CONFIG(78, "Configuration error"),
  EX_TIMEOUT(79, "Read timeout");

  private final int code;
  private final String description;

  public static Optional<Status> fromCode(final int code) {
    for (Status s : values()) if (s.code == code) return Optional.of(s);
    return Optional.empty();
  }
}
