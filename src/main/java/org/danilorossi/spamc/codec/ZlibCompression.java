package org.danilorossi.spamc.codec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;
import lombok.NonNull;
import lombok.val;

/** zlib stream format (RFC 1950), as spamd reads and writes it. */
public class ZlibCompression implements Compression {

  public static final String TOKEN = "zlib";

  /** Upper bound for an inflated body; spamd refuses much smaller messages anyway. */
  private static final int MAX_INFLATED_BYTES = 256 * 1024 * 1024;

  @Override
  public String token() {
    return TOKEN;
  }

  @Override
  public byte[] compress(@NonNull final byte[] data) {
    val deflater = new Deflater();
    try {
      deflater.setInput(data);
      deflater.finish();
      val out = new ByteArrayOutputStream(Math.max(64, data.length / 2));
      val buf = new byte[8192];
      while (!deflater.finished()) {
        int n = deflater.deflate(buf);
        out.write(buf, 0, n);
      }
      return out.toByteArray();
    } finally {
      deflater.end();
    }
  }

  @Override
  public byte[] decompress(@NonNull final byte[] data) throws IOException {
    val inflater = new Inflater();
    try {
      inflater.setInput(data);
      val out = new ByteArrayOutputStream(Math.max(64, data.length * 2));
      val buf = new byte[8192];
      while (!inflater.finished()) {
        int n = inflater.inflate(buf);
        if (n == 0 && (inflater.needsInput() || inflater.needsDictionary()))
          throw new IOException("Truncated zlib stream");
        out.write(buf, 0, n);
        if (out.size() > MAX_INFLATED_BYTES)
          throw new IOException("Inflated body exceeds " + MAX_INFLATED_BYTES + " bytes");
      }
      return out.toByteArray();
    } catch (DataFormatException e) {
      throw new IOException("Invalid zlib stream: " + e.getMessage(), e);
    } finally {
      inflater.end();
    }
  }
}
