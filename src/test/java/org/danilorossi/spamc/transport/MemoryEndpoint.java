package org.danilorossi.spamc.transport;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.Getter;
import lombok.Setter;
import lombok.val;
import org.danilorossi.spamc.error.ConnectionException;

/**
 * In-memory endpoint with fault injection: every connect yields a transport that replays a canned
 * response and records what the client wrote.
 */
public class MemoryEndpoint extends Endpoint {

  private final String name;
  @Getter private final AtomicInteger connects = new AtomicInteger();
  @Getter private final List<Transport> opened = new CopyOnWriteArrayList<>();
  @Getter private final List<ByteArrayOutputStream> written = new CopyOnWriteArrayList<>();

  @Setter private volatile String response = "SPAMD/1.5 0 PONG\r\n\r\n";
  @Setter private volatile boolean failWrites;
  private final AtomicInteger failConnects = new AtomicInteger();

  public MemoryEndpoint(final String name) {
    this.name = name;
  }

  /** The next {@code n} connects are refused. */
  public MemoryEndpoint failNextConnects(final int n) {
    failConnects.set(n);
    return this;
  }

  @Override
  public Transport connect(final Duration connectTimeout) throws ConnectionException {
    if (failConnects.getAndUpdate(n -> Math.max(0, n - 1)) > 0)
      throw new ConnectionException("Connection refused by " + name, null);
    connects.incrementAndGet();
    final OutputStream out;
    if (failWrites) {
      out =
          new OutputStream() {
            @Override
            public void write(final int b) throws IOException {
              throw new IOException("Broken pipe");
            }
          };
    } else {
      val sink = new ByteArrayOutputStream();
      written.add(sink);
      out = sink;
    }
    val in = new ByteArrayInputStream(response.getBytes(StandardCharsets.UTF_8));
    val t = new Transport(this, in, out, () -> {});
    opened.add(t);
    return t;
  }

  @Override
  public String toString() {
    return "memory:" + name;
  }
}
