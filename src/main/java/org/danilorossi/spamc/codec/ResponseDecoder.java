package org.danilorossi.spamc.codec;

import java.util.regex.Pattern;
import lombok.NonNull;
import lombok.val;
import org.danilorossi.spamc.error.MalformedHeaderException;
import org.danilorossi.spamc.error.MalformedResponseException;
import org.danilorossi.spamc.error.MalformedStatusLineException;
import org.danilorossi.spamc.error.SpamcException;
import org.danilorossi.spamc.protocol.Headers;
import org.danilorossi.spamc.protocol.Response;

/**
 * Incremental SPAMD response parser: {@code SPAMD/<d.d> <code> <message>}, headers, body. A
 * response without Content-length runs until the peer closes.
 */
public final class ResponseDecoder extends SpamdDecoder<Response> {

  private static final Pattern STATUS_LINE =
      Pattern.compile("^SPAMD/(\\d+\\.\\d+)[ \\t]+(\\S+)(?:[ \\t]+(.*))?$");

  private String version;
  private int statusCode;
  private String statusMessage;

  public ResponseDecoder() {
    this(Compressions.defaults());
  }

  public ResponseDecoder(@NonNull final Compressions compressions) {
    super(compressions);
  }

  /** One-shot decode of a complete byte sequence, as if the peer closed right after it. */
  public static Response decode(@NonNull final byte[] bytes) throws SpamcException {
    val decoder = new ResponseDecoder();
    decoder.feed(bytes, 0, bytes.length);
    return decoder.endOfStream();
  }

  /** The framed response; only valid once {@link #isComplete()}. */
  public Response getResponse() {
    return message();
  }

  @Override
  protected void onStartLine(final String text) throws MalformedStatusLineException {
    val m = STATUS_LINE.matcher(text);
    if (!m.matches()) throw new MalformedStatusLineException("Invalid status line", text);
    val code = m.group(2);
    if (!code.chars().allMatch(c -> c >= '0' && c <= '9') || code.length() > 9)
      throw new MalformedStatusLineException("Invalid status code", text);
    version = m.group(1);
    statusCode = Integer.parseInt(code);
    statusMessage = m.group(3) == null ? "" : m.group(3).trim();
  }

  @Override
  protected SpamcException startLineTooLong(final String preview) {
    return new MalformedStatusLineException("Status line too long", preview);
  }

  @Override
  protected SpamcException headerError(final String message, final Throwable cause) {
    if (cause instanceof MalformedHeaderException) return (MalformedHeaderException) cause;
    return new MalformedHeaderException(message, cause);
  }

  @Override
  protected SpamcException bodyError(final String message, final Throwable cause) {
    return new MalformedResponseException(message, cause);
  }

  @Override
  protected boolean bodyUntilClose() {
    return true;
  }

  @Override
  protected Response assemble(final Headers headers, final byte[] body) {
    return Response.builder()
        .protocolVersion(version)
        .statusCode(statusCode)
        .statusMessage(statusMessage)
        .headers(headers)
        .body(body)
        .build();
  }
}
