package org.danilorossi.spamc.codec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;
import org.danilorossi.spamc.error.EncodeException;
import org.danilorossi.spamc.helpers.LangUtils;
import org.danilorossi.spamc.protocol.Headers;
import org.danilorossi.spamc.protocol.Request;
import org.danilorossi.spamc.protocol.Response;

/**
 * Serializes requests (and, for test daemons, responses) into the SPAMC/SPAMD framing:
 *
 * <pre>
 * CHECK SPAMC/1.5\r\n
 * Content-length: 1234\r\n
 * User: alice\r\n
 * \r\n
 * &lt;body bytes&gt;
 * </pre>
 *
 * Decoding lives in {@link ResponseDecoder}, which is incremental.
 */
@UtilityClass
public class SpamdCodec {

  public static final String REQUEST_PROTOCOL = "SPAMC";
  public static final String RESPONSE_PROTOCOL = "SPAMD";

  private static final byte[] CRLF = {'\r', '\n'};

  public static byte[] encode(@NonNull final Request request) {
    return encode(request, Compressions.defaults());
  }

  /**
   * Encodes a request. The body is compressed first when {@link Request#isCompress()} is set, and
   * {@code Content-length} always matches the bytes that follow the blank line.
   *
   * @throws EncodeException if an explicit Content-length or Compress header contradicts the
   *     computed one
   */
  public static byte[] encode(@NonNull final Request request, @NonNull final Compressions registry) {
    val headers = request.getHeaders().copy();
    byte[] body = request.getBody();

    if (request.isCompress() && body != null) {
      val token = headers.get(Headers.COMPRESS).orElse(ZlibCompression.TOKEN);
      val compression =
          registry
              .lookup(token)
              .orElseThrow(() -> new EncodeException("Unsupported compression: " + token));
      body = compression.compress(body);
      if (!headers.contains(Headers.COMPRESS)) headers.add(Headers.COMPRESS, compression.token());
    } else if (headers.contains(Headers.COMPRESS)) {
      throw new EncodeException("Compress header given but the request is not compressed");
    }

    reconcileContentLength(headers, body, body != null);

    val out = new ByteArrayOutputStream(256 + (body == null ? 0 : body.length));
    writeAscii(
        out,
        LangUtils.s(
            "{} {}/{}",
            request.getCommand().getVerb(),
            REQUEST_PROTOCOL,
            request.getProtocolVersion()));
    writeHeadersAndBody(out, headers, body);
    return out.toByteArray();
  }

  /**
   * Encodes a response as spamd would send it. A {@code Compress} header makes the body go out
   * compressed; {@code Content-length} is added when a body is present and the header is missing.
   */
  public static byte[] encode(@NonNull final Response response) {
    return encode(response, Compressions.defaults());
  }

  public static byte[] encode(
      @NonNull final Response response, @NonNull final Compressions registry) {
    val headers = response.getHeaders().copy();
    byte[] body = response.getBody();
    val compressToken = headers.get(Headers.COMPRESS);
    if (compressToken.isPresent() && body != null) {
      val compression =
          registry
              .lookup(compressToken.get())
              .orElseThrow(
                  () -> new EncodeException("Unsupported compression: " + compressToken.get()));
      body = compression.compress(body);
    }
    reconcileContentLength(headers, body, body != null);

    val out = new ByteArrayOutputStream(256 + (body == null ? 0 : body.length));
    val status = new StringBuilder()
        .append(RESPONSE_PROTOCOL).append('/').append(response.getProtocolVersion())
        .append(' ').append(response.getStatusCode());
    if (!response.getStatusMessage().isEmpty()) status.append(' ').append(response.getStatusMessage());
    writeAscii(out, status.toString());
    writeHeadersAndBody(out, headers, body);
    return out.toByteArray();
  }

  /**
   * A caller-supplied Content-length is kept (with its casing and position) only when it states
   * the real body length. Otherwise the computed header goes first.
   */
  private static void reconcileContentLength(
      final Headers headers, final byte[] body, final boolean emitWhenMissing) {
    val length = body == null ? 0 : body.length;
    val explicit = headers.getAll(Headers.CONTENT_LENGTH);
    if (explicit.size() > 1)
      throw new EncodeException("Content-length given more than once: " + explicit);
    if (explicit.size() == 1) {
      val declared = LangUtils.parseIntOr(explicit.get(0), -1);
      if (declared != length)
        throw new EncodeException(
            LangUtils.s(
                "Explicit Content-length '{}' does not match body length {}",
                explicit.get(0),
                length));
      return;
    }
    if (emitWhenMissing) headers.addFirst(Headers.CONTENT_LENGTH, String.valueOf(length));
  }

  private static void writeHeadersAndBody(
      final ByteArrayOutputStream out, final Headers headers, final byte[] body) {
    for (val e : headers) {
      out.writeBytes((e.getName() + ": " + e.getValue()).getBytes(StandardCharsets.UTF_8));
      out.writeBytes(CRLF);
    }
    out.writeBytes(CRLF);
    if (body != null) out.writeBytes(body);
  }

  private static void writeAscii(final ByteArrayOutputStream out, final String line) {
    out.writeBytes(line.getBytes(StandardCharsets.US_ASCII));
    out.writeBytes(CRLF);
  }
}
