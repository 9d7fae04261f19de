package org.danilorossi.spamc.transport;

import java.nio.file.Paths;
import java.time.Duration;
import lombok.NonNull;
import lombok.val;
import org.danilorossi.spamc.error.ConnectionException;
import org.danilorossi.spamc.helpers.LangUtils;

/**
 * Where spamd listens. Endpoints are value objects: two equal endpoints share pooled connections.
 *
 * <p>Accepted textual forms for {@link #parse(String)}:
 *
 * <ul>
 *   <li>{@code host}, {@code host:port}, {@code [::1]:port}, {@code tcp://host:port}
 *   <li>{@code ssl://host:port} (TLS)
 *   <li>{@code /path/to/spamd.sock}, {@code unix:/path/to/spamd.sock}
 * </ul>
 */
public abstract class Endpoint {

  public static final int DEFAULT_PORT = 783;

  /**
   * Opens a new connection.
   *
   * @throws ConnectionException refused, timed out, unresolved host, TLS failure, missing socket
   */
  public abstract Transport connect(@NonNull Duration connectTimeout) throws ConnectionException;

  public static Endpoint parse(@NonNull final String text) {
    val s = text.trim();
    if (s.isEmpty()) throw new IllegalArgumentException("Empty endpoint");
    if (s.startsWith("unix:")) return new UnixSocketEndpoint(Paths.get(s.substring(5)));
    if (s.startsWith("/")) return new UnixSocketEndpoint(Paths.get(s));

    boolean ssl = false;
    String rest = s;
    if (rest.startsWith("ssl://")) {
      ssl = true;
      rest = rest.substring(6);
    } else if (rest.startsWith("tcp://")) {
      rest = rest.substring(6);
    }

    String host;
    int port = DEFAULT_PORT;
    if (rest.startsWith("[")) {
      val close = rest.indexOf(']');
      if (close < 0) throw new IllegalArgumentException("Unterminated IPv6 address: " + text);
      host = rest.substring(1, close);
      val tail = rest.substring(close + 1);
      if (!tail.isEmpty()) {
        if (!tail.startsWith(":")) throw new IllegalArgumentException("Invalid endpoint: " + text);
        port = parsePort(tail.substring(1), text);
      }
    } else {
      val colon = rest.lastIndexOf(':');
      if (colon >= 0 && rest.indexOf(':') == colon) {
        host = rest.substring(0, colon);
        port = parsePort(rest.substring(colon + 1), text);
      } else {
        // bare IPv6 without brackets: no port
        host = rest;
      }
    }
    if (LangUtils.empty(host)) throw new IllegalArgumentException("Missing host: " + text);
    return new TcpEndpoint(host, port, ssl);
  }

  private static int parsePort(final String value, final String text) {
    val port = LangUtils.parseIntOr(value, -1);
    if (port < 1 || port > 65535)
      throw new IllegalArgumentException(LangUtils.s("Invalid port '{}' in {}", value, text));
    return port;
  }
}
