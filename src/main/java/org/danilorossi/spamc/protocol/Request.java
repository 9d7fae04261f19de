package org.danilorossi.spamc.protocol;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.val;
import org.danilorossi.spamc.error.InvalidHeaderValueException;
import org.danilorossi.spamc.error.InvalidRequestException;
import org.danilorossi.spamc.helpers.LangUtils;

/**
 * One SPAMC request. Validated on construction and immutable afterwards: the header set is frozen
 * and the body is copied in and out.
 */
@Getter
@ToString(exclude = "body")
@EqualsAndHashCode
public final class Request {

  public static final String DEFAULT_VERSION = "1.5";

  private static final Pattern VERSION = Pattern.compile("\\d+\\.\\d+");

  private final Command command;
  private final String protocolVersion;
  private final Headers headers;

  @Getter(lombok.AccessLevel.NONE)
  private final byte[] body;

  private final boolean compress;

  @Builder
  private Request(
      @NonNull final Command command,
      final String protocolVersion,
      final Headers headers,
      final byte[] body,
      final boolean compress) {
    val version = LangUtils.empty(protocolVersion) ? DEFAULT_VERSION : protocolVersion.trim();
    if (!VERSION.matcher(version).matches())
      throw new InvalidRequestException(LangUtils.s("Invalid protocol version '{}'", version));

    if (command.requiresBody() && body == null)
      throw new InvalidRequestException(LangUtils.s("{} requires a message body", command));
    if (!command.requiresBody() && body != null)
      throw new InvalidRequestException(LangUtils.s("{} does not take a message body", command));

    val h = headers == null ? new Headers() : headers;
    for (val e : h) validateHeader(e.getName(), e.getValue());

    this.command = command;
    this.protocolVersion = version;
    this.headers = h.freeze();
    this.body = body == null ? null : body.clone();
    this.compress = compress;
  }

  public static Request newRequest(
      @NonNull final Command command, final Headers headers, final byte[] body) {
    return builder().command(command).headers(headers).body(body).build();
  }

  /** Copy of the message body, or null for body-less commands. */
  public byte[] getBody() {
    return body == null ? null : body.clone();
  }

  public boolean hasBody() {
    return body != null;
  }

  public int getBodyLength() {
    return body == null ? 0 : body.length;
  }

  /** Body as UTF-8 text, for logs and tests. */
  public String bodyAsString() {
    return body == null ? null : new String(body, StandardCharsets.UTF_8);
  }

  static void validateHeader(final String name, final String value) {
    if (LangUtils.empty(name))
      throw new InvalidRequestException("Header name is blank");
    if (name.indexOf(':') >= 0 || LangUtils.hasLineBreak(name))
      throw new InvalidRequestException(
          LangUtils.s("Header name contains a forbidden character: '{}'", name.strip()));
    if (!name.equals(name.strip()))
      throw new InvalidRequestException(
          LangUtils.s("Header name has surrounding whitespace: '{}'", name));
    if (LangUtils.hasLineBreak(value))
      throw new InvalidHeaderValueException(
          LangUtils.s("Value of header '{}' contains CR or LF", name));
    if (name.equalsIgnoreCase(Headers.USER) && !HeaderValues.isValidUser(value.trim()))
      throw new InvalidHeaderValueException(
          LangUtils.s("Invalid user name '{}': only letters, digits, '-' and '_'", value));
  }
}
