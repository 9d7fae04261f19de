package org.danilorossi.spamc.protocol;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.val;

/** Value of the {@code Message-class} header used by TELL. */
@AllArgsConstructor
public enum MessageClass {
  HAM("ham"),
  SPAM("spam");

  @Getter private final String token;

  public static MessageClass parse(final String s) {
    if (s == null) return null;
    val n = s.trim().toLowerCase();
    return switch (n) {
      case "ham" -> HAM;
      case "spam" -> SPAM;
      default -> null;
    };
  }
}
