package org.danilorossi.spamc.protocol;

import java.util.regex.Pattern;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import org.danilorossi.spamc.error.MalformedHeaderException;

/** Parsers for the structured header values spamd sends back. */
@UtilityClass
public class HeaderValues {

  private static final Pattern USER = Pattern.compile("[A-Za-z0-9_-]+");

  /** spamd user names: letters, digits, '-' and '_', at least one. */
  public static boolean isValidUser(final String value) {
    return value != null && USER.matcher(value).matches();
  }

  /** The "Spam:" header looks like: "True ; 6.3 / 5.0" OR "False ; 0.1 / 5.0" */
  public static ScoreLine parseSpam(@NonNull final String headerValue)
      throws MalformedHeaderException {
    String v = headerValue.trim();
    boolean isSpam;

    // Boolean (True/False, spamd also sends Yes/No on some builds)
    if (v.regionMatches(true, 0, "true", 0, 4)) {
      isSpam = true;
      v = v.substring(4).trim();
    } else if (v.regionMatches(true, 0, "false", 0, 5)) {
      isSpam = false;
      v = v.substring(5).trim();
    } else if (v.regionMatches(true, 0, "yes", 0, 3)) {
      isSpam = true;
      v = v.substring(3).trim();
    } else if (v.regionMatches(true, 0, "no", 0, 2)) {
      isSpam = false;
      v = v.substring(2).trim();
    } else {
      throw new MalformedHeaderException("Cannot parse 'Spam' header boolean: " + headerValue);
    }

    if (v.startsWith(";")) v = v.substring(1).trim();

    // Expect "<score> / <threshold>"
    int slash = v.indexOf('/');
    if (slash < 0) {
      throw new MalformedHeaderException(
          "Cannot parse score/threshold in 'Spam' header: " + headerValue);
    }
    String left = v.substring(0, slash).trim().replace("score=", "").trim();
    String right = v.substring(slash + 1).trim().replace("required=", "").trim();

    final double score;
    final double threshold;
    try {
      score = Double.parseDouble(left);
    } catch (NumberFormatException e) {
      throw new MalformedHeaderException("Invalid score in 'Spam' header: " + headerValue, e);
    }
    try {
      threshold = Double.parseDouble(right);
    } catch (NumberFormatException e) {
      throw new MalformedHeaderException("Invalid threshold in 'Spam' header: " + headerValue, e);
    }
    return new ScoreLine(isSpam, score, threshold);
  }

  public static ActionOption parseAction(@NonNull final String name, @NonNull final String value)
      throws MalformedHeaderException {
    ActionOption parsed = ActionOption.parse(value);
    if (parsed == null)
      throw new MalformedHeaderException("Invalid '" + name + "' header value: " + value);
    return parsed;
  }

  public static MessageClass parseMessageClass(@NonNull final String value)
      throws MalformedHeaderException {
    MessageClass parsed = MessageClass.parse(value);
    if (parsed == null)
      throw new MalformedHeaderException("Invalid 'Message-class' header value: " + value);
    return parsed;
  }

  /** Non-negative decimal byte count. */
  public static int parseContentLength(@NonNull final String value)
      throws MalformedHeaderException {
    String v = value.trim();
    if (v.isEmpty() || !v.chars().allMatch(Character::isDigit))
      throw new MalformedHeaderException("Invalid Content-length: " + value);
    try {
      return Integer.parseInt(v);
    } catch (NumberFormatException e) {
      throw new MalformedHeaderException("Content-length out of range: " + value, e);
    }
  }
}
