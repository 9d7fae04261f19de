package org.danilorossi.spamc.model;

import java.nio.file.Paths;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;
import lombok.val;
import org.danilorossi.spamc.helpers.LangUtils;
import org.danilorossi.spamc.pool.PoolPolicy;
import org.danilorossi.spamc.protocol.HeaderValues;
import org.danilorossi.spamc.protocol.Request;
import org.danilorossi.spamc.transport.Endpoint;
import org.danilorossi.spamc.transport.TcpEndpoint;
import org.danilorossi.spamc.transport.UnixSocketEndpoint;

/** Connection settings of a spamd client, persisted as JSON by {@code JsonDb.config()}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true)
public class SpamdClientConfig {

  @Builder.Default private String host = "127.0.0.1";

  @Builder.Default private int port = Endpoint.DEFAULT_PORT;

  /** When set, the Unix socket wins over host and port. */
  private String socketPath;

  @Builder.Default private boolean ssl = false;

  /** optional; sent as the User header */
  private String user;

  /** ms */
  @Builder.Default private int connectTimeoutMillis = 3000;

  /** ms, budget for writing the request and reading the response */
  @Builder.Default private int readTimeoutMillis = 5000;

  @Builder.Default private int maxConnections = 8;

  @Builder.Default private PoolPolicy poolPolicy = PoolPolicy.WAIT;

  /** extra connect attempts after the first one fails */
  @Builder.Default private int connectRetries = 2;

  /** ms, multiplied by the attempt number */
  @Builder.Default private long retryBackoffMillis = 100;

  /** zlib-compress request bodies */
  @Builder.Default private boolean compress = false;

  @Builder.Default private String protocolVersion = Request.DEFAULT_VERSION;

  /** spamd closes after every response; only enable for a daemon that keeps connections open */
  @Builder.Default private boolean reuseConnections = false;

  /** ms */
  @Builder.Default private long maxIdleMillis = 30_000;

  /** Total deadline of one exchange when the call does not give its own. */
  public long exchangeTimeoutMillis() {
    return (long) connectTimeoutMillis + readTimeoutMillis;
  }

  public Endpoint toEndpoint() {
    validate();
    if (!LangUtils.empty(socketPath)) return new UnixSocketEndpoint(Paths.get(socketPath.trim()));
    return new TcpEndpoint(host, port, ssl);
  }

  public void validate() throws IllegalArgumentException {
    if (LangUtils.empty(socketPath)) {
      if (LangUtils.empty(host)) throw new IllegalArgumentException("spamd host is blank");
      if (port <= 0 || port > 65535)
        throw new IllegalArgumentException(LangUtils.s("spamd port is invalid: {}", port));
    }
    if (connectTimeoutMillis <= 0)
      throw new IllegalArgumentException("connectTimeoutMillis must be positive");
    if (readTimeoutMillis <= 0)
      throw new IllegalArgumentException("readTimeoutMillis must be positive");
    if (maxConnections < 1) throw new IllegalArgumentException("maxConnections must be positive");
    if (connectRetries < 0) throw new IllegalArgumentException("connectRetries is negative");
    if (retryBackoffMillis < 0) throw new IllegalArgumentException("retryBackoffMillis is negative");
    if (maxIdleMillis < 0) throw new IllegalArgumentException("maxIdleMillis is negative");
    val version = LangUtils.normalize(protocolVersion);
    if (!version.matches("\\d+\\.\\d+"))
      throw new IllegalArgumentException(
          LangUtils.s("protocolVersion is invalid: '{}'", protocolVersion));
    if (!LangUtils.empty(user) && !HeaderValues.isValidUser(user.trim()))
      throw new IllegalArgumentException(
          LangUtils.s("user is invalid: '{}' (letters, digits, '-' and '_' only)", user));
  }
}
