package org.danilorossi.spamc.transport;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.spamc.codec.ResponseDecoder;
import org.danilorossi.spamc.error.ExchangeCancelledException;
import org.danilorossi.spamc.error.SpamcException;
import org.danilorossi.spamc.error.SpamcTimeoutException;
import org.danilorossi.spamc.error.TransportException;
import org.danilorossi.spamc.error.WriteException;
import org.danilorossi.spamc.helpers.LangUtils;
import org.danilorossi.spamc.helpers.LogConfigurator;
import org.danilorossi.spamc.protocol.Response;

/**
 * One connection to spamd. A transport must be acquired ({@link #acquireIfIdle()}) before it can
 * send or receive, and only one exchange may own it at a time. Any I/O error, framing problem,
 * timeout or cancellation closes it for good: its framing state is unknown afterwards.
 */
@Log
public class Transport implements Closeable {

  static {
    LogConfigurator.configLog(log);
  }

  private static final AtomicLong IDS = new AtomicLong();
  static final int CHUNK_SIZE = 8192;

  @Getter private final long id = IDS.incrementAndGet();
  @Getter private final Endpoint endpoint;

  private final InputStream input;
  private final OutputStream output;
  private final Closeable resource;
  private final DeadlineWatchdog watchdog;

  private final Object stateLock = new Object();
  private TransportState state = TransportState.IDLE;

  private volatile AbortReason abortReason;
  private volatile int completedExchanges;
  private volatile boolean reusable = true;

  @Getter private final long openedAtMillis = System.currentTimeMillis();
  private volatile long lastUsedAtMillis = openedAtMillis;

  /**
   * @param resource closed together with the transport (the socket or channel behind the streams)
   */
  public Transport(
      @NonNull final Endpoint endpoint,
      @NonNull final InputStream input,
      @NonNull final OutputStream output,
      @NonNull final Closeable resource) {
    this(endpoint, input, output, resource, DeadlineWatchdog.shared());
  }

  public Transport(
      @NonNull final Endpoint endpoint,
      @NonNull final InputStream input,
      @NonNull final OutputStream output,
      @NonNull final Closeable resource,
      @NonNull final DeadlineWatchdog watchdog) {
    this.endpoint = endpoint;
    this.input = input;
    this.output = output;
    this.resource = resource;
    this.watchdog = watchdog;
  }

  // --------------------------------------------------------------------------------------------
  // Ownership
  // --------------------------------------------------------------------------------------------

  /** Marks the transport IN_USE if it is IDLE. Returns false if it is in use or closed. */
  public boolean acquireIfIdle() {
    synchronized (stateLock) {
      if (state != TransportState.IDLE) return false;
      state = TransportState.IN_USE;
      return true;
    }
  }

  /** Back to IDLE after a clean exchange. Returns false if it was not in use. */
  public boolean release() {
    synchronized (stateLock) {
      if (state != TransportState.IN_USE) return false;
      state = TransportState.IDLE;
      lastUsedAtMillis = System.currentTimeMillis();
      return true;
    }
  }

  public TransportState getState() {
    synchronized (stateLock) {
      return state;
    }
  }

  public boolean isClosed() {
    return getState() == TransportState.CLOSED;
  }

  /** Still open and never hit an error, an abort or an unframed (read-until-close) response. */
  public boolean isReusable() {
    return reusable && abortReason == null && !isClosed();
  }

  /** Responses fully framed on this transport; above zero means it came back from the pool. */
  public int getCompletedExchanges() {
    return completedExchanges;
  }

  public Duration getIdleTime() {
    if (getState() != TransportState.IDLE) return Duration.ZERO;
    return Duration.ofMillis(System.currentTimeMillis() - lastUsedAtMillis);
  }

  // --------------------------------------------------------------------------------------------
  // I/O
  // --------------------------------------------------------------------------------------------

  /**
   * Writes all bytes, chunk by chunk, before {@code deadline}.
   *
   * @throws WriteException if the socket fails; the transport is closed
   * @throws SpamcTimeoutException if the deadline elapses first
   */
  public void send(@NonNull final byte[] bytes, @NonNull final Instant deadline)
      throws SpamcException {
    ensureInUse();
    long written = 0;
    try (DeadlineWatchdog.Guard guard = watchdog.arm(this, deadline)) {
      int off = 0;
      while (off < bytes.length) {
        val n = Math.min(CHUNK_SIZE, bytes.length - off);
        output.write(bytes, off, n);
        off += n;
        written = off;
      }
      output.flush();
      lastUsedAtMillis = System.currentTimeMillis();
      LangUtils.debug(log, "Transport #{} sent {} bytes", id, bytes.length);
    } catch (IOException e) {
      reusable = false;
      close();
      throw failure(
          e,
          new WriteException(
              LangUtils.s(
                  "Write to {} failed after {} of {} bytes: {}",
                  endpoint,
                  written,
                  bytes.length,
                  LangUtils.exMsg(e)),
              written,
              e));
    }
  }

  /**
   * Reads until {@code decoder} frames a complete response, the peer closes or the deadline
   * elapses.
   *
   * @throws org.danilorossi.spamc.error.UnexpectedEofException peer closed mid-response
   * @throws org.danilorossi.spamc.error.MalformedResponseException daemon output is not SPAMD
   * @throws SpamcTimeoutException deadline elapsed
   */
  public Response receive(@NonNull final ResponseDecoder decoder, @NonNull final Instant deadline)
      throws SpamcException {
    ensureInUse();
    try (DeadlineWatchdog.Guard guard = watchdog.arm(this, deadline)) {
      val buf = new byte[CHUNK_SIZE];
      while (true) {
        val n = input.read(buf);
        if (n <= 0) {
          if (abortReason != null) throw new IOException("Transport aborted");
          reusable = false;
          LangUtils.debug(log, "Transport #{}: peer closed the connection", id);
          return decoder.endOfStream();
        }
        if (decoder.feed(buf, 0, n) == ResponseDecoder.State.COMPLETE) {
          if (decoder.getExcessBytes() > 0) {
            reusable = false;
            LangUtils.warn(
                log,
                "Transport #{}: {} bytes after the end of the response",
                id,
                decoder.getExcessBytes());
          }
          lastUsedAtMillis = System.currentTimeMillis();
          completedExchanges++;
          return decoder.getResponse();
        }
      }
    } catch (SpamcException e) {
      reusable = false;
      close();
      throw e;
    } catch (IOException e) {
      reusable = false;
      close();
      throw failure(
          e,
          new TransportException(
              LangUtils.s("Read from {} failed: {}", endpoint, LangUtils.exMsg(e)), e));
    }
  }

  /**
   * Closes the transport underneath any blocked I/O. The pending operation fails with a timeout or
   * cancellation error according to {@code reason}.
   */
  public void abort(@NonNull final AbortReason reason) {
    if (abortReason == null) abortReason = reason;
    LangUtils.debug(log, "Transport #{} aborted: {}", id, reason);
    close();
  }

  /** Closes the underlying socket. Idempotent. */
  @Override
  public void close() {
    synchronized (stateLock) {
      if (state == TransportState.CLOSED) return;
      state = TransportState.CLOSED;
    }
    reusable = false;
    try {
      resource.close();
    } catch (IOException e) {
      LangUtils.debug(log, "Transport #{}: error while closing: {}", id, LangUtils.exMsg(e));
    }
  }

  private void ensureInUse() throws SpamcException {
    val current = getState();
    if (current == TransportState.IN_USE) return;
    if (current == TransportState.CLOSED)
      throw failure(
          new IOException("closed"),
          new TransportException(LangUtils.s("Transport #{} to {} is closed", id, endpoint)));
    throw new IllegalStateException("Transport #" + id + " used without being acquired");
  }

  private SpamcException failure(final IOException cause, final SpamcException otherwise) {
    val reason = abortReason;
    if (reason == AbortReason.TIMEOUT)
      return new SpamcTimeoutException(
          LangUtils.s("Deadline elapsed talking to {}", endpoint), cause);
    if (reason == AbortReason.CANCELLED)
      return new ExchangeCancelledException(
          LangUtils.s("Exchange with {} cancelled", endpoint), cause);
    return otherwise;
  }

  @Override
  public String toString() {
    return "Transport#" + id + "(" + endpoint + ", " + getState() + ")";
  }
}
