package org.danilorossi.spamc.protocol;

import java.util.ArrayList;
import lombok.Value;
import lombok.val;

/**
 * Target databases of a TELL operation: {@code local} (Bayes) and/or {@code remote} (reporting
 * services). Used by the {@code Set}, {@code Remove}, {@code DidSet} and {@code DidRemove}
 * headers.
 */
@Value
public class ActionOption {

  public static final ActionOption NONE = new ActionOption(false, false);
  public static final ActionOption LOCAL = new ActionOption(true, false);
  public static final ActionOption REMOTE = new ActionOption(false, true);
  public static final ActionOption BOTH = new ActionOption(true, true);

  boolean local;
  boolean remote;

  public boolean isEmpty() {
    return !local && !remote;
  }

  /** Wire form, e.g. {@code local, remote}. Empty string for {@link #NONE}. */
  public String toHeaderValue() {
    val parts = new ArrayList<String>(2);
    if (local) parts.add("local");
    if (remote) parts.add("remote");
    return String.join(", ", parts);
  }

  /** Parses {@code local}, {@code remote} or both in any order; null if anything else is present. */
  public static ActionOption parse(final String s) {
    if (s == null) return null;
    boolean local = false;
    boolean remote = false;
    for (val raw : s.split(",")) {
      val token = raw.trim().toLowerCase();
      switch (token) {
        case "local" -> local = true;
        case "remote" -> remote = true;
        default -> {
          return null;
        }
      }
    }
    return new ActionOption(local, remote);
  }
}
