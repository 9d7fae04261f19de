package org.danilorossi.spamc.db;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;
import lombok.NonNull;
import lombok.Synchronized;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.spamc.helpers.FileSystemUtils;
import org.danilorossi.spamc.helpers.LangUtils;
import org.danilorossi.spamc.helpers.LogConfigurator;
import org.danilorossi.spamc.model.SpamdClientConfig;

/**
 * Layer di persistenza basato su file JSON sotto la cartella dati di {@link FileSystemUtils}.
 *
 * <p>Thread-safety: ogni store ha un lock statico e i metodi pubblici che accedono al file sono
 * annotati con @Synchronized("<LOCK_NAME>").
 */
@Log
public class JsonDb implements AutoCloseable {

  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().serializeNulls().disableHtmlEscaping().create();

  static {
    LogConfigurator.configLog(log);
  }

  public static Gson gson() {
    return GSON;
  }

  public JsonDb() {}

  /**
   * Legge un file JSON. Se il file non esiste o la lettura fallisce viene restituito il valore di
   * default.
   */
  private static <T> T readOrDefault(
      @NonNull final Path file, @NonNull final Class<T> type, @NonNull final Supplier<T> def) {
    try {
      if (!Files.exists(file)) return def.get();
      val json = FileSystemUtils.readUtf8(file);
      val obj = gson().fromJson(json, type);
      return obj != null ? obj : def.get();
    } catch (RuntimeException ex) {
      LangUtils.warn(log, "Errore lettura {}: {}", ex, file, LangUtils.rootCauseMsg(ex));
      return def.get();
    }
  }

  /** Scrive un oggetto su file JSON in maniera atomica (tmp + move). */
  private static <T> void writeAtomic(@NonNull final Path file, @NonNull final T payload) {
    try {
      val json = gson().toJson(payload);
      FileSystemUtils.writeUtf8Atomic(file, json);
    } catch (RuntimeException ex) {
      LangUtils.err(log, "Errore scrittura {}: {}", ex, file, LangUtils.rootCauseMsg(ex));
      throw ex;
    }
  }

  public ClientConfigStore config() {
    return new ClientConfigStore();
  }

  @Override
  public void close() {
    /* niente da chiudere */
  }

  /** File singolo: configurazione del client spamd. */
  public static class ClientConfigStore {
    private static final Object CONFIG_LOCK = new Object();

    private Path file() {
      return FileSystemUtils.getClientConfigJson();
    }

    /** Config salvata, o i default se il file manca o non è leggibile. */
    @Synchronized("CONFIG_LOCK")
    public SpamdClientConfig load() {
      return readOrDefault(
          file(), SpamdClientConfig.class, () -> SpamdClientConfig.builder().build());
    }

    /** Valida e salva; una config non valida non viene scritta. */
    @Synchronized("CONFIG_LOCK")
    public void save(@NonNull final SpamdClientConfig cfg) {
      cfg.validate();
      writeAtomic(file(), cfg);
    }
  }
}
