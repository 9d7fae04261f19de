package org.danilorossi.spamc.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import org.danilorossi.spamc.error.MalformedHeaderException;

/** One SPAMD response: status line, headers and optional body (null when spamd sent none). */
@Getter
@ToString(exclude = "body")
@EqualsAndHashCode
public final class Response {

  private final String protocolVersion;
  private final int statusCode;
  private final String statusMessage;
  private final Headers headers;

  @Getter(lombok.AccessLevel.NONE)
  private final byte[] body;

  @Builder
  private Response(
      @NonNull final String protocolVersion,
      final int statusCode,
      final String statusMessage,
      final Headers headers,
      final byte[] body) {
    this.protocolVersion = protocolVersion;
    this.statusCode = statusCode;
    this.statusMessage = statusMessage == null ? "" : statusMessage;
    this.headers = headers == null ? new Headers().freeze() : headers.freeze();
    this.body = body == null || body.length == 0 ? null : body.clone();
  }

  public byte[] getBody() {
    return body == null ? null : body.clone();
  }

  public boolean hasBody() {
    return body != null;
  }

  public String bodyAsString() {
    return body == null ? null : new String(body, StandardCharsets.UTF_8);
  }

  public Optional<Status> getStatus() {
    return Status.fromCode(statusCode);
  }

  public boolean isOk() {
    return statusCode == Status.EX_OK.getCode();
  }

  /** Parsed {@code Spam} header, empty when the daemon did not send one. */
  public Optional<ScoreLine> getScore() throws MalformedHeaderException {
    Optional<String> raw = headers.get(Headers.SPAM);
    if (raw.isEmpty()) return Optional.empty();
    return Optional.of(HeaderValues.parseSpam(raw.get()));
  }

  public Optional<ActionOption> getDidSet() throws MalformedHeaderException {
    Optional<String> raw = headers.get(Headers.DID_SET);
    if (raw.isEmpty()) return Optional.empty();
    return Optional.of(HeaderValues.parseAction(Headers.DID_SET, raw.get()));
  }

  public Optional<ActionOption> getDidRemove() throws MalformedHeaderException {
    Optional<String> raw = headers.get(Headers.DID_REMOVE);
    if (raw.isEmpty()) return Optional.empty();
    return Optional.of(HeaderValues.parseAction(Headers.DID_REMOVE, raw.get()));
  }
}
