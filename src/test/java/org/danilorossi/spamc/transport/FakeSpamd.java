package org.danilorossi.spamc.transport;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.ServerSocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.Getter;
import lombok.Value;
import lombok.val;
import org.danilorossi.spamc.codec.RequestDecoder;
import org.danilorossi.spamc.codec.SpamdCodec;
import org.danilorossi.spamc.protocol.Headers;
import org.danilorossi.spamc.protocol.Request;
import org.danilorossi.spamc.protocol.Response;

/**
 * Loopback spamd for tests. Reads one SPAMC request per connection, hands it to a {@link Handler}
 * and closes the connection, as the real daemon does.
 */
public final class FakeSpamd implements AutoCloseable {

  @Value
  public static class Received {
    Request request;

    public String getRequestLine() {
      return request.getCommand().getVerb() + " SPAMC/" + request.getProtocolVersion();
    }

    public Headers getHeaders() {
      return request.getHeaders();
    }

    /** Body as the daemon sees it, decompressed. */
    public byte[] getBody() {
      return request.getBody();
    }

    public String verb() {
      return request.getCommand().getVerb();
    }
  }

  @FunctionalInterface
  public interface Handler {
    void handle(Received request, OutputStream out) throws IOException;
  }

  private interface Acceptor {
    Conn accept() throws IOException;
  }

  private static final class Conn {
    final InputStream in;
    final OutputStream out;
    final Closeable resource;

    Conn(final InputStream in, final OutputStream out, final Closeable resource) {
      this.in = in;
      this.out = out;
      this.resource = resource;
    }
  }

  @Getter private final Endpoint endpoint;
  private final Closeable server;
  private final Handler handler;
  private final List<Received> received = new CopyOnWriteArrayList<>();
  private final AtomicInteger connections = new AtomicInteger();
  private final Set<Closeable> live = ConcurrentHashMap.newKeySet();
  private volatile boolean closed;

  private FakeSpamd(
      final Endpoint endpoint, final Closeable server, final Handler handler, final Acceptor acceptor) {
    this.endpoint = endpoint;
    this.server = server;
    this.handler = handler;
    val t = new Thread(() -> acceptLoop(acceptor), "fake-spamd-accept");
    t.setDaemon(true);
    t.start();
  }

  public static FakeSpamd tcp(final Handler handler) throws IOException {
    val ss = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
    val endpoint = new TcpEndpoint(InetAddress.getLoopbackAddress().getHostAddress(), ss.getLocalPort());
    return new FakeSpamd(
        endpoint,
        ss,
        handler,
        () -> {
          val s = ss.accept();
          return new Conn(s.getInputStream(), s.getOutputStream(), s);
        });
  }

  public static FakeSpamd unix(final Path socketFile, final Handler handler) throws IOException {
    val ch = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
    ch.bind(UnixDomainSocketAddress.of(socketFile));
    return new FakeSpamd(
        new UnixSocketEndpoint(socketFile),
        ch,
        handler,
        () -> {
          val c = ch.accept();
          return new Conn(Channels.newInputStream(c), Channels.newOutputStream(c), c);
        });
  }

  /** Answers every request with the same encoded response. */
  public static Handler reply(final Response response) {
    val bytes = SpamdCodec.encode(response);
    return (req, out) -> out.write(bytes);
  }

  public static Handler raw(final String wire) {
    val bytes = wire.getBytes(StandardCharsets.UTF_8);
    return (req, out) -> out.write(bytes);
  }

  /** Reads the request and never answers. */
  public static Handler hangForever() {
    return (req, out) -> {
      try {
        Thread.sleep(60_000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    };
  }

  public List<Received> getReceived() {
    return received;
  }

  public Received last() {
    return received.get(received.size() - 1);
  }

  public int getConnectionCount() {
    return connections.get();
  }

  private void acceptLoop(final Acceptor acceptor) {
    while (!closed) {
      final Conn conn;
      try {
        conn = acceptor.accept();
      } catch (IOException e) {
        if (closed) return;
        continue;
      }
      connections.incrementAndGet();
      live.add(conn.resource);
      val t = new Thread(() -> serve(conn), "fake-spamd-conn");
      t.setDaemon(true);
      t.start();
    }
  }

  private void serve(final Conn conn) {
    try {
      val request = readRequest(conn.in);
      if (request == null) return;
      received.add(request);
      handler.handle(request, conn.out);
      conn.out.flush();
    } catch (IOException e) {
      // client went away
    } finally {
      live.remove(conn.resource);
      try {
        conn.resource.close();
      } catch (IOException ignored) {
        // already gone
      }
    }
  }

  static Received readRequest(final InputStream in) throws IOException {
    val decoder = new RequestDecoder();
    val buf = new byte[4096];
    int n;
    while ((n = in.read(buf)) > 0) {
      if (decoder.feed(buf, 0, n) == RequestDecoder.State.COMPLETE)
        return new Received(decoder.getRequest());
    }
    if (decoder.getBytesReceived() == 0) return null;
    return new Received(decoder.endOfStream());
  }

  @Override
  public void close() throws IOException {
    closed = true;
    server.close();
    for (val c : live) {
      try {
        c.close();
      } catch (IOException ignored) {
        // closing anyway
      }
    }
  }
}
