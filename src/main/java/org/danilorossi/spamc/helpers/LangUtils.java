package org.danilorossi.spamc.helpers;

import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;

@UtilityClass
public class LangUtils {

  public static int parseIntOr(final String s, final int def) {
    try {
      return Integer.parseInt(s == null ? "" : s.trim());
    } catch (NumberFormatException ignored) {
      return def;
    }
  }

  public static boolean empty(final String content) {
    return content == null || content.isBlank();
  }

  public static String normalize(final String s) {
    return s == null ? "" : s.trim();
  }

  /** True if the string contains a CR or LF. */
  public static boolean hasLineBreak(@NonNull final String s) {
    return s.indexOf('\r') >= 0 || s.indexOf('\n') >= 0;
  }

  public static String exMsg(@NonNull final Throwable t) {
    return empty(t.getMessage()) ? t.toString() : t.getMessage();
  }

  public static String rootCauseMsg(final Throwable t) {
    if (t == null) return "Null Throwable";
    if (t.getCause() != null && t.getCause() != t) return rootCauseMsg(t.getCause());
    return exMsg(t);
  }

  /** Formatta con segnaposto "{}". */
  public static String s(final String format, final Object... values) {
    if (values == null || values.length == 0) return normalize(format);
    return String.format(format.replace("{}", "%s"), values);
  }

  public static void l(Logger logger, Level level, String format, Throwable t, Object... values) {
    if (logger == null || level == null) return;
    if (!logger.isLoggable(level)) return;
    val message = (values == null || values.length == 0) ? normalize(format) : s(format, values);
    if (t == null) logger.log(level, message);
    else logger.log(level, message, t);
  }

  public static void l(Logger logger, Level level, String format, Object... values) {
    l(logger, level, format, null, values);
  }

  public static void info(Logger logger, String format, Object... values) {
    l(logger, Level.INFO, format, values);
  }

  public static void warn(Logger logger, String format, Object... values) {
    l(logger, Level.WARNING, format, values);
  }

  public static void err(Logger logger, String format, Object... values) {
    l(logger, Level.SEVERE, format, values);
  }

  public static void debug(Logger logger, String format, Object... values) {
    l(logger, Level.FINE, format, values);
  }

  public static void warn(Logger logger, String format, Throwable t, Object... values) {
    l(logger, Level.WARNING, format, t, values);
  }

  public static void err(Logger logger, String format, Throwable t, Object... values) {
    l(logger, Level.SEVERE, format, t, values);
  }

  public static void debug(Logger logger, String format, Throwable t, Object... values) {
    l(logger, Level.FINE, format, t, values);
  }
}
