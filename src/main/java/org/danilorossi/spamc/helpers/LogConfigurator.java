package org.danilorossi.spamc.helpers;

import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.util.HashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;

/**
 * Shared JUL setup for every class of the library. By default records go to the console; with
 * {@code -Dspamc.logFile=<name>} they go to a rotating file under the data directory.
 */
@UtilityClass
public class LogConfigurator {

  public static final String PROP_LOG_FILE = "spamc.logFile";
  public static final String PROP_LOG_LEVEL = "LOG_LEVEL";

  private static final Handler LOG_HANDLER;
  private static final AtomicBoolean ONCE = new AtomicBoolean(false);

  static {
    Handler handler = new ConsoleHandler();
    val logFile = System.getProperty(PROP_LOG_FILE, "");
    if (!LangUtils.empty(logFile)) {
      try {
        handler =
            new FileHandler(
                FileSystemUtils.getDataPath(logFile).toAbsolutePath().toString(),
                1_000_000,
                5,
                true); // 1MB, 5 file
      } catch (IOException | RuntimeException ex) {
        System.err.println(
            LangUtils.s("Impossibile aprire il file di log {}, uso la console: {}", logFile,
                LangUtils.exMsg(ex)));
      }
    }
    handler.setFormatter(new SimpleFormatter());
    handler.setLevel(Level.ALL);
    try {
      handler.setEncoding("UTF-8");
    } catch (UnsupportedEncodingException ex) {
      System.err.println(LangUtils.s("UTF-8 non supportato dal log handler: {}", ex));
    }

    LOG_HANDLER = handler;
    Runtime.getRuntime().addShutdownHook(new Thread(LOG_HANDLER::close, "spamc-log-shutdown"));
  }

  public static void configLog(@NonNull final Logger logger) {
    // rimuove eventuali handler già presenti
    for (val h : logger.getHandlers()) logger.removeHandler(h);
    logger.addHandler(LOG_HANDLER);
    logger.setLevel(resolveLogLevel(System.getProperty(PROP_LOG_LEVEL, "INFO")));
    logger.setUseParentHandlers(false);
    if (ONCE.compareAndSet(false, true))
      LogManager.getLogManager().getLogger("").setLevel(logger.getLevel());
  }

  static Level resolveLogLevel(@NonNull final String levelName) {
    // Mappa friendly name → JUL Level
    val map = new HashMap<String, Level>();
    map.put("DEBUG", Level.FINE);
    map.put("TRACE", Level.FINEST);
    map.put("WARN", Level.WARNING);
    map.put("ERROR", Level.SEVERE);

    val key = levelName.trim().toUpperCase();
    if (map.containsKey(key)) return map.get(key);

    try {
      return Level.parse(key);
    } catch (IllegalArgumentException e) {
      return Level.INFO;
    }
  }
}
