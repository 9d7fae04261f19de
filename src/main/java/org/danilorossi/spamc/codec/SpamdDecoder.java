package org.danilorossi.spamc.codec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;
import lombok.Getter;
import lombok.NonNull;
import lombok.val;
import org.danilorossi.spamc.error.MalformedHeaderException;
import org.danilorossi.spamc.error.SpamcException;
import org.danilorossi.spamc.error.UnexpectedEofException;
import org.danilorossi.spamc.helpers.LangUtils;
import org.danilorossi.spamc.protocol.HeaderValues;
import org.danilorossi.spamc.protocol.Headers;

/**
 * Resumable parser for the framing both directions share: a start line, {@code Name: Value}
 * header lines, a blank line and the body. Bytes are pushed in whatever chunks the socket
 * delivers with {@link #feed(byte[], int, int)}; a peer close is reported with {@link
 * #endOfStream()}. Partial lines and body bytes are kept between calls, so feeding one byte at a
 * time gives the same result as feeding everything at once.
 *
 * <p>Subclasses parse the start line, build the message and choose the exception types. One
 * instance per message; not thread-safe.
 *
 * @param <T> the decoded message
 */
public abstract class SpamdDecoder<T> {

  public enum State {
    START_LINE,
    HEADERS,
    BODY,
    COMPLETE
  }

  static final int MAX_LINE_BYTES = 64 * 1024;
  static final int MAX_BODY_BYTES = 256 * 1024 * 1024;

  private static final Pattern HEADER_NAME = Pattern.compile("[A-Za-z0-9_-]+");

  private final Compressions compressions;

  @Getter private State state = State.START_LINE;

  private final ByteArrayOutputStream line = new ByteArrayOutputStream(128);
  private final Headers headers = new Headers();

  // Content-length framed body
  private byte[] declaredBody;
  private int bodyRead;
  // read-until-close body
  private ByteArrayOutputStream openBody;

  private T message;

  /** Every byte fed so far, excess included. */
  @Getter private long bytesReceived;

  /** Bytes received after the message was complete. */
  @Getter private long excessBytes;

  /** True when the body had no Content-length and ended with the peer closing. */
  @Getter private boolean completedByEof;

  protected SpamdDecoder(@NonNull final Compressions compressions) {
    this.compressions = compressions;
  }

  /** Parses the first line; called once, without the line terminator. */
  protected abstract void onStartLine(String text) throws SpamcException;

  protected abstract SpamcException startLineTooLong(String preview);

  protected abstract SpamcException headerError(String message, Throwable cause);

  protected abstract SpamcException bodyError(String message, Throwable cause);

  /** Whether a message without Content-length has a body that runs until the peer closes. */
  protected abstract boolean bodyUntilClose();

  /** Builds the message from the parsed headers and the (decompressed) body. */
  protected abstract T assemble(Headers headers, byte[] body) throws SpamcException;

  public State feed(@NonNull final byte[] data) throws SpamcException {
    return feed(data, 0, data.length);
  }

  /**
   * Consumes a chunk of bytes.
   *
   * @return the state after the chunk; {@link State#COMPLETE} once the message is framed
   */
  public State feed(@NonNull final byte[] data, final int off, final int len)
      throws SpamcException {
    if (off < 0 || len < 0 || off + len > data.length)
      throw new IndexOutOfBoundsException("off=" + off + " len=" + len + " size=" + data.length);
    bytesReceived += len;
    int i = off;
    val end = off + len;
    while (i < end) {
      switch (state) {
        case START_LINE, HEADERS -> {
          val b = data[i++];
          if (b == '\n') {
            val text = takeLine();
            if (state == State.START_LINE) {
              onStartLine(text);
              state = State.HEADERS;
            } else onHeaderLine(text);
          } else {
            line.write(b);
            if (line.size() > MAX_LINE_BYTES) {
              if (state == State.START_LINE) throw startLineTooLong(preview());
              throw headerError("Header line longer than " + MAX_LINE_BYTES + " bytes", null);
            }
          }
        }
        case BODY -> {
          if (declaredBody != null) {
            val n = Math.min(end - i, declaredBody.length - bodyRead);
            System.arraycopy(data, i, declaredBody, bodyRead, n);
            bodyRead += n;
            i += n;
            if (bodyRead == declaredBody.length) complete(declaredBody);
          } else {
            openBody.write(data, i, end - i);
            i = end;
            if (openBody.size() > MAX_BODY_BYTES)
              throw bodyError("Unframed body longer than " + MAX_BODY_BYTES + " bytes", null);
          }
        }
        case COMPLETE -> {
          excessBytes += end - i;
          i = end;
        }
      }
    }
    return state;
  }

  /**
   * The peer closed the connection. Completes a body without Content-length; fails if a declared
   * body, the start line or a header line is still incomplete.
   */
  public T endOfStream() throws SpamcException {
    switch (state) {
      case COMPLETE -> {
        return message;
      }
      case START_LINE -> throw new UnexpectedEofException(
          line.size() == 0
              ? "Connection closed before the first line"
              : "Connection closed in the middle of the first line");
      case HEADERS -> {
        if (line.size() > 0)
          throw new UnexpectedEofException("Connection closed in the middle of a header line");
        // chiusura su confine di riga senza riga vuota: niente body
        val declared = headers.get(Headers.CONTENT_LENGTH);
        if (declared.isPresent() && contentLength(declared.get()) > 0)
          throw new UnexpectedEofException(
              "Connection closed before the headers ended, body of "
                  + declared.get().trim()
                  + " bytes expected");
        completedByEof = true;
        complete(new byte[0]);
        return message;
      }
      case BODY -> {
        if (declaredBody != null)
          throw new UnexpectedEofException(
              LangUtils.s(
                  "Connection closed after {} of {} body bytes", bodyRead, declaredBody.length));
        completedByEof = true;
        complete(openBody.toByteArray());
        return message;
      }
    }
    throw new IllegalStateException("Unknown state " + state);
  }

  public boolean isComplete() {
    return state == State.COMPLETE;
  }

  /** The framed message; only valid once {@link #isComplete()}. */
  protected T message() {
    if (state != State.COMPLETE) throw new IllegalStateException("Message not complete: " + state);
    return message;
  }

  private void onHeaderLine(final String text) throws SpamcException {
    if (text.isEmpty()) {
      onEndOfHeaders();
      return;
    }
    val first = text.charAt(0);
    if (first == ' ' || first == '\t') {
      if (headers.isEmpty())
        throw headerError("Continuation line without a header: '" + text + "'", null);
      headers.appendToLast(text.trim());
      return;
    }
    val colon = text.indexOf(':');
    if (colon <= 0) throw headerError("Header without colon: '" + text + "'", null);
    val name = text.substring(0, colon).trim();
    if (!HEADER_NAME.matcher(name).matches())
      throw headerError("Invalid header name: '" + name + "'", null);
    headers.add(name, text.substring(colon + 1).trim());
  }

  private void onEndOfHeaders() throws SpamcException {
    val declared = headers.getAll(Headers.CONTENT_LENGTH);
    if (declared.isEmpty()) {
      if (!bodyUntilClose()) {
        complete(new byte[0]);
        return;
      }
      openBody = new ByteArrayOutputStream(1024);
      state = State.BODY;
      return;
    }
    int length = contentLength(declared.get(0));
    for (val other : declared)
      if (contentLength(other) != length)
        throw headerError("Conflicting Content-length headers: " + declared, null);
    if (length > MAX_BODY_BYTES) throw headerError("Content-length too large: " + length, null);
    if (length == 0) {
      complete(new byte[0]);
      return;
    }
    declaredBody = new byte[length];
    bodyRead = 0;
    state = State.BODY;
  }

  private int contentLength(final String value) throws SpamcException {
    try {
      return HeaderValues.parseContentLength(value);
    } catch (MalformedHeaderException e) {
      throw headerError(e.getMessage(), e);
    }
  }

  private void complete(final byte[] wireBody) throws SpamcException {
    byte[] body = wireBody;
    val token = headers.get(Headers.COMPRESS);
    if (token.isPresent() && body.length > 0) {
      val compression = compressions.lookup(token.get());
      if (compression.isEmpty()) throw headerError("Unsupported compression: " + token.get(), null);
      try {
        body = compression.get().decompress(body);
      } catch (IOException e) {
        throw bodyError("Cannot decompress body: " + e.getMessage(), e);
      }
    }
    message = assemble(headers, body);
    state = State.COMPLETE;
    declaredBody = null;
    openBody = null;
  }

  private String takeLine() {
    val bytes = line.toByteArray();
    line.reset();
    int len = bytes.length;
    if (len > 0 && bytes[len - 1] == '\r') len--;
    return new String(bytes, 0, len, StandardCharsets.UTF_8);
  }

  private String preview() {
    val bytes = line.toByteArray();
    return new String(bytes, 0, Math.min(bytes.length, 80), StandardCharsets.UTF_8);
  }
}
