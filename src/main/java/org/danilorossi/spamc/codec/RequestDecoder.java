package org.danilorossi.spamc.codec;

import java.util.regex.Pattern;
import lombok.NonNull;
import lombok.val;
import org.danilorossi.spamc.error.InvalidRequestException;
import org.danilorossi.spamc.error.MalformedRequestException;
import org.danilorossi.spamc.error.SpamcException;
import org.danilorossi.spamc.protocol.Command;
import org.danilorossi.spamc.protocol.Headers;
import org.danilorossi.spamc.protocol.Request;

/**
 * Incremental SPAMC request parser, the daemon side of {@link SpamdCodec#encode(Request)}:
 * {@code <COMMAND> SPAMC/<d.d>}, headers, body.
 *
 * <p>The decoded {@link Request} keeps the headers as received, {@code Content-length} (the wire
 * length) included; a compressed body is handed out decompressed. Without Content-length a
 * body-less command (PING) ends at the blank line, the others read until the peer closes. Every
 * failure, header and request validation included, is a {@link MalformedRequestException}, except
 * a premature close, which stays an {@link org.danilorossi.spamc.error.UnexpectedEofException}.
 */
public final class RequestDecoder extends SpamdDecoder<Request> {

  private static final Pattern REQUEST_LINE =
      Pattern.compile("^([A-Za-z_]+)[ \\t]+SPAMC/(\\d+\\.\\d+)[ \\t]*$");

  private Command command;
  private String version;

  public RequestDecoder() {
    this(Compressions.defaults());
  }

  public RequestDecoder(@NonNull final Compressions compressions) {
    super(compressions);
  }

  /** One-shot decode of a complete byte sequence, as if the peer closed right after it. */
  public static Request decode(@NonNull final byte[] bytes) throws SpamcException {
    val decoder = new RequestDecoder();
    decoder.feed(bytes, 0, bytes.length);
    return decoder.endOfStream();
  }

  /** The framed request; only valid once {@link #isComplete()}. */
  public Request getRequest() {
    return message();
  }

  @Override
  protected void onStartLine(final String text) throws MalformedRequestException {
    val m = REQUEST_LINE.matcher(text);
    if (!m.matches()) throw new MalformedRequestException("Invalid request line: '" + text + "'");
    command = Command.fromVerb(m.group(1));
    if (command == null)
      throw new MalformedRequestException("Unknown command: '" + m.group(1) + "'");
    version = m.group(2);
  }

  @Override
  protected SpamcException startLineTooLong(final String preview) {
    return new MalformedRequestException("Request line too long: '" + preview + "'");
  }

  @Override
  protected SpamcException headerError(final String message, final Throwable cause) {
    return new MalformedRequestException(message, cause);
  }

  @Override
  protected SpamcException bodyError(final String message, final Throwable cause) {
    return new MalformedRequestException(message, cause);
  }

  @Override
  protected boolean bodyUntilClose() {
    return command.requiresBody();
  }

  @Override
  protected Request assemble(final Headers headers, final byte[] body)
      throws MalformedRequestException {
    try {
      return Request.builder()
          .command(command)
          .protocolVersion(version)
          .headers(headers)
          .body(command.requiresBody() || body.length > 0 ? body : null)
          .compress(headers.contains(Headers.COMPRESS))
          .build();
    } catch (InvalidRequestException e) {
      throw new MalformedRequestException(e.getMessage(), e);
    }
  }
}
