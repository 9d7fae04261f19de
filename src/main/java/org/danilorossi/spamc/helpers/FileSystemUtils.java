package org.danilorossi.spamc.helpers;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;

@UtilityClass
public class FileSystemUtils {

  public static final String PROP_HOME = "spamc.home"; // override opzionale
  private static final String DIR_DATA = "data";

  private static final String CLIENT_JSON = "spamc.json";

  /** Restituisce la cartella "data" dove salvare config e log. */
  public static Path getDataDir() {
    // 1) Override esplicito: -Dspamc.home=/percorso/custom
    val override = System.getProperty(PROP_HOME);
    if (!LangUtils.empty(override)) return ensureDir(normalize(Paths.get(override)));

    // 2) Sviluppo: ENV DEV
    val dev = System.getenv("DEV");
    if (!LangUtils.empty(dev)) return ensureDir(cwd().resolve(DIR_DATA));

    // 3) Deduci dalla posizione dell'app (jar o classes/)
    val base = resolveExecutableBaseDir();
    if (base != null) return ensureDir(base.resolve(DIR_DATA));

    // 4) Fallback: CWD/data
    return ensureDir(cwd().resolve(DIR_DATA));
  }

  /** Path a spamc.json. */
  public static Path getClientConfigJson() {
    return getDataDir().resolve(CLIENT_JSON);
  }

  /** Restituisce un file generico sotto data/. */
  public static Path getDataPath(@NonNull String fileName) {
    return getDataDir().resolve(fileName);
  }

  private static Path cwd() {
    return normalize(Paths.get("."));
  }

  private static Path normalize(@NonNull final Path p) {
    return p.toAbsolutePath().normalize();
  }

  private static Path ensureDir(@NonNull final Path dir) {
    try {
      Files.createDirectories(dir);
      if (!Files.isDirectory(dir))
        throw new IOException(LangUtils.s("Path exists but is not a directory: {}", dir));
      return dir;
    } catch (IOException e) {
      throw new UncheckedIOException(LangUtils.s("Cannot create directory: {}", dir), e);
    }
  }

  /**
   * Base dell'eseguibile: jar ⇒ parent; .../target/classes ⇒ parent di classes; altrimenti
   * location. Null if the code source cannot be resolved.
   */
  private static Path resolveExecutableBaseDir() {
    val cs = FileSystemUtils.class.getProtectionDomain().getCodeSource();
    if (cs == null || cs.getLocation() == null) return null;
    final Path loc;
    try {
      loc = normalize(Paths.get(cs.getLocation().toURI()));
    } catch (URISyntaxException | IllegalArgumentException e) {
      return null;
    }
    if (Files.isRegularFile(loc)) return normalize(loc.getParent()); // jar
    val name = loc.getFileName() != null ? loc.getFileName().toString() : "";
    if ("classes".equals(name)) return normalize(loc.getParent()); // .../target
    return loc;
  }

  /** Scrive testo UTF-8 in modo atomico (tmp nella stessa dir + move). */
  public static void writeUtf8Atomic(@NonNull final Path _target, @NonNull final String content) {
    val target = normalize(_target);
    ensureDir(target.getParent());
    try {
      val tmp =
          Files.createTempFile(target.getParent(), target.getFileName().toString() + "-", ".tmp");
      try {
        Files.writeString(tmp, content, StandardCharsets.UTF_8, CREATE, TRUNCATE_EXISTING, WRITE);
        try {
          Files.move(tmp, target, REPLACE_EXISTING, ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException __) {
          Files.move(tmp, target, REPLACE_EXISTING);
        }
      } finally {
        Files.deleteIfExists(tmp);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(LangUtils.s("Cannot write file: {}", target), e);
    }
  }

  /** Legge testo UTF-8 (eccezione runtime semplificata). */
  public static String readUtf8(@NonNull final Path file) {
    try {
      return Files.readString(normalize(file), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(LangUtils.s("Cannot read file: {}", file), e);
    }
  }
}
