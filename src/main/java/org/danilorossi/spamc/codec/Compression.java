package org.danilorossi.spamc.codec;

import java.io.IOException;

/** Body compression negotiated through the {@code Compress} header. */
public interface Compression {

  /** Token sent in the {@code Compress} header, e.g. {@code zlib}. */
  String token();

  byte[] compress(byte[] data);

  byte[] decompress(byte[] data) throws IOException;
}
