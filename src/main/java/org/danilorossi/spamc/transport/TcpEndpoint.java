package org.danilorossi.spamc.transport;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.spamc.error.ConnectionException;
import org.danilorossi.spamc.helpers.LangUtils;
import org.danilorossi.spamc.helpers.LogConfigurator;

/** spamd on a TCP port, optionally behind TLS. */
@Log
@Getter
@EqualsAndHashCode(callSuper = false, exclude = "sslSocketFactory")
public final class TcpEndpoint extends Endpoint {

  static {
    LogConfigurator.configLog(log);
  }

  private final String host;
  private final int port;
  private final boolean ssl;
  private final SSLSocketFactory sslSocketFactory;

  public TcpEndpoint(@NonNull final String host, final int port) {
    this(host, port, false);
  }

  public TcpEndpoint(@NonNull final String host, final int port, final boolean ssl) {
    this(host, port, ssl, null);
  }

  /** @param sslSocketFactory used when {@code ssl} is set; null for the JVM default */
  public TcpEndpoint(
      @NonNull final String host,
      final int port,
      final boolean ssl,
      final SSLSocketFactory sslSocketFactory) {
    if (LangUtils.empty(host)) throw new IllegalArgumentException("Host is blank");
    if (port < 1 || port > 65535) throw new IllegalArgumentException("Invalid port: " + port);
    this.host = host.trim();
    this.port = port;
    this.ssl = ssl;
    this.sslSocketFactory = sslSocketFactory;
  }

  @Override
  public Transport connect(@NonNull final Duration connectTimeout) throws ConnectionException {
    val address = new InetSocketAddress(host, port);
    if (address.isUnresolved())
      throw new ConnectionException(LangUtils.s("Cannot resolve host '{}'", host), null);

    val timeoutMillis = (int) Math.max(1, Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()));
    Socket socket = new Socket();
    try {
      socket.setTcpNoDelay(true);
      socket.connect(address, timeoutMillis);
      if (ssl) socket = handshake(socket, timeoutMillis);
      LangUtils.debug(log, "Connected to {}", this);
      return new Transport(
          this,
          new BufferedInputStream(socket.getInputStream(), Transport.CHUNK_SIZE),
          socket.getOutputStream(),
          socket);
    } catch (SocketTimeoutException e) {
      closeQuietly(socket);
      throw new ConnectionException(
          LangUtils.s("Connect to {} timed out after {} ms", this, timeoutMillis), e);
    } catch (IOException e) {
      closeQuietly(socket);
      throw new ConnectionException(
          LangUtils.s("Cannot connect to {}: {}", this, LangUtils.exMsg(e)), e);
    }
  }

  private SSLSocket handshake(final Socket plain, final int timeoutMillis) throws IOException {
    val factory =
        sslSocketFactory != null
            ? sslSocketFactory
            : (SSLSocketFactory) SSLSocketFactory.getDefault();
    val tls = (SSLSocket) factory.createSocket(plain, host, port, true);
    tls.setSoTimeout(timeoutMillis);
    tls.startHandshake();
    tls.setSoTimeout(0);
    return tls;
  }

  private static void closeQuietly(final Socket socket) {
    try {
      socket.close();
    } catch (IOException e) {
      LangUtils.debug(log, "Error closing socket after failed connect: {}", LangUtils.exMsg(e));
    }
  }

  @Override
  public String toString() {
    val h = host.indexOf(':') >= 0 ? "[" + host + "]" : host;
    return (ssl ? "ssl://" : "tcp://") + h + ":" + port;
  }
}
