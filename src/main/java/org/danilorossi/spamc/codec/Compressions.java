package org.danilorossi.spamc.codec;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.NonNull;

/** Registry of the compression algorithms the client understands, keyed by header token. */
public final class Compressions {

  private final Map<String, Compression> byToken = new LinkedHashMap<>();

  /** A new registry holding zlib. Each call returns its own instance. */
  public static Compressions defaults() {
    return new Compressions().register(new ZlibCompression());
  }

  public synchronized Compressions register(@NonNull final Compression compression) {
    byToken.put(compression.token().toLowerCase(Locale.ROOT), compression);
    return this;
  }

  public synchronized Optional<Compression> lookup(final String token) {
    if (token == null) return Optional.empty();
    return Optional.ofNullable(byToken.get(token.trim().toLowerCase(Locale.ROOT)));
  }
}
