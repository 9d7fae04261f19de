package org.danilorossi.spamc.spamassassin;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.spamc.codec.Compressions;
import org.danilorossi.spamc.codec.ResponseDecoder;
import org.danilorossi.spamc.codec.SpamdCodec;
import org.danilorossi.spamc.error.ConnectionException;
import org.danilorossi.spamc.error.ExchangeCancelledException;
import org.danilorossi.spamc.error.SpamcException;
import org.danilorossi.spamc.error.SpamcTimeoutException;
import org.danilorossi.spamc.error.TransportException;
import org.danilorossi.spamc.helpers.LangUtils;
import org.danilorossi.spamc.helpers.LogConfigurator;
import org.danilorossi.spamc.pool.ConnectionPool;
import org.danilorossi.spamc.protocol.Request;
import org.danilorossi.spamc.protocol.Response;
import org.danilorossi.spamc.transport.AbortReason;
import org.danilorossi.spamc.transport.Endpoint;
import org.danilorossi.spamc.transport.Transport;

/**
 * Runs request/response exchanges: encode, acquire a transport, send, receive, give the transport
 * back. An exchange is atomic from the caller's point of view: it yields a complete {@link
 * Response} or a typed {@link SpamcException} carrying the command and the endpoint. Only
 * connection establishment is retried, together with the case of a pooled connection the peer
 * closed while it sat idle (nothing came back, so the request goes out again on a new one).
 *
 * <p>Well-formed responses are returned whatever their status code; mapping non-zero codes to
 * errors is left to {@link SpamAssassinClient}.
 */
@Log
public class SpamdDispatcher implements AutoCloseable {

  static {
    LogConfigurator.configLog(log);
  }

  private static final AtomicInteger THREADS = new AtomicInteger();

  @Getter private final ConnectionPool pool;
  private final Compressions compressions;
  @Getter private final int connectRetries;
  @Getter private final Duration retryBackoff;
  private final ExecutorService executor;
  private final boolean ownsExecutor;

  /**
   * @param executor runs {@link #executeAsync}; a cached pool of daemon threads if null, shut down
   *     by {@link #close()}
   */
  @Builder
  public SpamdDispatcher(
      @NonNull final ConnectionPool pool,
      final Compressions compressions,
      final int connectRetries,
      final Duration retryBackoff,
      final ExecutorService executor) {
    if (connectRetries < 0) throw new IllegalArgumentException("connectRetries is negative");
    this.pool = pool;
    this.compressions = compressions == null ? Compressions.defaults() : compressions;
    this.connectRetries = connectRetries;
    this.retryBackoff = retryBackoff == null ? Duration.ofMillis(100) : retryBackoff;
    this.ownsExecutor = executor == null;
    this.executor =
        executor != null
            ? executor
            : Executors.newCachedThreadPool(
                r -> {
                  val t = new Thread(r, "spamc-exchange-" + THREADS.incrementAndGet());
                  t.setDaemon(true);
                  return t;
                });
  }

  /**
   * Runs one exchange on the calling thread.
   *
   * @param timeout budget for the whole exchange: pool wait, connect, send and receive
   * @throws org.danilorossi.spamc.error.EncodeException before any I/O, if the request cannot be
   *     framed
   */
  public Response execute(
      @NonNull final Request request,
      @NonNull final Endpoint endpoint,
      @NonNull final Duration timeout)
      throws SpamcException {
    return run(request, endpoint, timeout, new Exchange());
  }

  /**
   * Runs one exchange on the dispatcher executor. Cancelling the returned future aborts the
   * exchange: the transport is closed and never returned to the pool.
   */
  public CompletableFuture<Response> executeAsync(
      @NonNull final Request request,
      @NonNull final Endpoint endpoint,
      @NonNull final Duration timeout) {
    val exchange = new Exchange();
    val future = new ExchangeFuture(exchange);
    executor.execute(
        () -> {
          exchange.start(Thread.currentThread());
          try {
            future.complete(run(request, endpoint, timeout, exchange));
          } catch (SpamcException | RuntimeException e) {
            future.completeExceptionally(e);
          } finally {
            exchange.finish();
          }
        });
    return future;
  }

  private Response run(
      final Request request, final Endpoint endpoint, final Duration timeout, final Exchange ex)
      throws SpamcException {
    val command = request.getCommand();
    val wire = SpamdCodec.encode(request, compressions);
    val deadline = Instant.now().plus(timeout);

    while (true) {
      final Transport transport;
      try {
        transport = acquire(endpoint, deadline, ex);
      } catch (SpamcException e) {
        throw e.attach(command, endpoint);
      }

      val reused = transport.getCompletedExchanges() > 0;
      val decoder = new ResponseDecoder(compressions);
      try {
        ex.bind(transport);
        transport.send(wire, deadline);
        val response = transport.receive(decoder, deadline);
        ex.unbind();
        pool.release(transport);
        LangUtils.debug(
            log,
            "{} to {}: {} {}",
            command,
            endpoint,
            response.getStatusCode(),
            response.getStatusMessage());
        return response;
      } catch (SpamcException e) {
        ex.unbind();
        pool.discard(transport);
        if (reused && closedWhilePooled(e, decoder)) {
          LangUtils.debug(
              log,
              "{} to {}: pooled {} was closed by the peer, reconnecting",
              command,
              endpoint,
              transport);
          continue;
        }
        LangUtils.debug(log, "{} to {} failed: {}", command, endpoint, LangUtils.exMsg(e));
        throw e.attach(command, endpoint);
      } catch (RuntimeException e) {
        ex.unbind();
        pool.discard(transport);
        throw e;
      }
    }
  }

  /** A pooled transport failed before the daemon sent a single byte. */
  private static boolean closedWhilePooled(final SpamcException e, final ResponseDecoder decoder) {
    return decoder.getBytesReceived() == 0
        && e instanceof TransportException
        && !(e instanceof SpamcTimeoutException)
        && !(e instanceof ExchangeCancelledException);
  }

  private Transport acquire(final Endpoint endpoint, final Instant deadline, final Exchange ex)
      throws SpamcException {
    int attempt = 0;
    while (true) {
      ex.checkNotCancelled(endpoint);
      try {
        return pool.acquire(endpoint, deadline);
      } catch (ConnectionException e) {
        if (attempt >= connectRetries) throw e;
        attempt++;
        val pause = retryBackoff.multipliedBy(attempt);
        if (Instant.now().plus(pause).isAfter(deadline)) throw e;
        LangUtils.warn(
            log,
            "Connect to {} failed ({}), retry {} of {} in {} ms",
            endpoint,
            LangUtils.exMsg(e),
            attempt,
            connectRetries,
            pause.toMillis());
        try {
          Thread.sleep(pause.toMillis());
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new ExchangeCancelledException(
              LangUtils.s("Exchange with {} cancelled during connect retry", endpoint), ie);
        }
      }
    }
  }

  /** Shuts down the executor if the dispatcher created it, then closes the pool. */
  @Override
  public void close() {
    if (ownsExecutor) executor.shutdownNow();
    pool.close();
  }

  /** Cancellation link between an async future and the worker running its exchange. */
  static final class Exchange {
    private volatile boolean cancelled;
    private volatile Transport transport;
    private Thread worker;

    synchronized void start(final Thread thread) {
      worker = thread;
    }

    synchronized void finish() {
      worker = null;
    }

    void bind(final Transport t) throws ExchangeCancelledException {
      transport = t;
      if (cancelled) {
        t.abort(AbortReason.CANCELLED);
        throw new ExchangeCancelledException(
            LangUtils.s("Exchange with {} cancelled", t.getEndpoint()), null);
      }
    }

    void unbind() {
      transport = null;
    }

    void checkNotCancelled(final Endpoint endpoint) throws ExchangeCancelledException {
      if (cancelled)
        throw new ExchangeCancelledException(
            LangUtils.s("Exchange with {} cancelled", endpoint), null);
    }

    void cancel() {
      cancelled = true;
      val t = transport;
      if (t != null) {
        t.abort(AbortReason.CANCELLED);
        return;
      }
      synchronized (this) {
        // waiting for a pool slot or sleeping between connect attempts
        if (worker != null && transport == null) worker.interrupt();
      }
    }
  }

  static final class ExchangeFuture extends CompletableFuture<Response> {
    private final Exchange exchange;

    ExchangeFuture(final Exchange exchange) {
      this.exchange = exchange;
    }

    @Override
    public boolean cancel(final boolean mayInterruptIfRunning) {
      val cancelled = super.cancel(mayInterruptIfRunning);
      if (cancelled) exchange.cancel();
      return cancelled;
    }
  }
}
