package org.danilorossi.spamc.pool;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.spamc.error.ConnectionException;
import org.danilorossi.spamc.error.ExchangeCancelledException;
import org.danilorossi.spamc.error.PoolExhaustedException;
import org.danilorossi.spamc.error.SpamcException;
import org.danilorossi.spamc.error.SpamcTimeoutException;
import org.danilorossi.spamc.helpers.LangUtils;
import org.danilorossi.spamc.helpers.LogConfigurator;
import org.danilorossi.spamc.transport.Endpoint;
import org.danilorossi.spamc.transport.Transport;

/**
 * Connection pool with a global cap on open transports and FIFO admission.
 *
 * <p>All pool state lives under one {@link ReentrantLock}. Connecting happens outside the lock: the
 * caller first reserves a slot (counted in {@link #getOpenCount()}), then connects, then either
 * turns the reservation into a lease or gives the slot back.
 *
 * <p>Idle transports are kept per endpoint. When the cap is reached and the caller's endpoint has
 * nothing idle, an idle transport of another endpoint is closed to make room.
 */
@Log
public class BoundedConnectionPool implements ConnectionPool {

  static {
    LogConfigurator.configLog(log);
  }

  @Getter private final int maxConnections;
  @Getter private final PoolPolicy policy;
  @Getter private final Duration connectTimeout;
  @Getter private final boolean reuseConnections;
  @Getter private final Duration maxIdle;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();

  private final Map<Endpoint, Deque<Transport>> idle = new HashMap<>();
  private final Set<Transport> leased = Collections.newSetFromMap(new IdentityHashMap<>());
  private final Deque<Long> waiters = new ArrayDeque<>();
  private long nextTicket;
  private int open;
  private boolean closed;

  /**
   * @param maxConnections global cap, at least 1
   * @param policy behaviour when the cap is reached; WAIT if null
   * @param connectTimeout upper bound for a single connect; 3 s if null
   * @param reuseConnections keep healthy transports for later exchanges
   * @param maxIdle idle transports older than this are closed; null or zero keeps them forever
   */
  @Builder
  public BoundedConnectionPool(
      final int maxConnections,
      final PoolPolicy policy,
      final Duration connectTimeout,
      final boolean reuseConnections,
      final Duration maxIdle) {
    if (maxConnections < 1)
      throw new IllegalArgumentException("maxConnections must be positive: " + maxConnections);
    this.maxConnections = maxConnections;
    this.policy = policy == null ? PoolPolicy.WAIT : policy;
    this.connectTimeout = connectTimeout == null ? Duration.ofSeconds(3) : connectTimeout;
    if (this.connectTimeout.isNegative() || this.connectTimeout.isZero())
      throw new IllegalArgumentException("connectTimeout must be positive");
    this.reuseConnections = reuseConnections;
    this.maxIdle = maxIdle == null ? Duration.ZERO : maxIdle;
  }

  @Override
  public Transport acquire(@NonNull final Endpoint endpoint, @NonNull final Instant deadline)
      throws SpamcException {
    lock.lock();
    try {
      ensureOpen();
      val ticket = nextTicket++;
      waiters.addLast(ticket);
      try {
        while (true) {
          ensureOpen();
          expireIdle();
          if (waiters.peekFirst() == ticket) {
            val pooled = pollIdle(endpoint);
            if (pooled != null) {
              leased.add(pooled);
              LangUtils.debug(log, "Reusing {}", pooled);
              return pooled;
            }
            if (open < maxConnections || evictOtherEndpoint(endpoint)) {
              open++;
              break;
            }
          }
          if (policy == PoolPolicy.FAIL_FAST)
            throw new PoolExhaustedException(
                LangUtils.s("All {} connections are in use", maxConnections));
          val remaining = Duration.between(Instant.now(), deadline).toNanos();
          if (remaining <= 0)
            throw new SpamcTimeoutException(
                LangUtils.s("Timed out waiting for one of {} connections", maxConnections));
          changed.awaitNanos(remaining);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new ExchangeCancelledException("Interrupted while waiting for a connection", e);
      } finally {
        waiters.remove(ticket);
        changed.signalAll();
      }
    } finally {
      lock.unlock();
    }
    return connectReserved(endpoint, deadline);
  }

  private Transport connectReserved(final Endpoint endpoint, final Instant deadline)
      throws SpamcException {
    val remaining = Duration.between(Instant.now(), deadline);
    val timeout = remaining.compareTo(connectTimeout) < 0 ? remaining : connectTimeout;
    final Transport transport;
    try {
      if (timeout.isNegative() || timeout.isZero())
        throw new SpamcTimeoutException(
            LangUtils.s("Deadline elapsed before connecting to {}", endpoint));
      transport = endpoint.connect(timeout);
    } catch (SpamcException | RuntimeException e) {
      freeSlot();
      throw e;
    }
    transport.acquireIfIdle();
    lock.lock();
    try {
      if (closed) {
        open--;
        changed.signalAll();
        transport.close();
        throw new ConnectionException("Connection pool is closed", null);
      }
      leased.add(transport);
    } finally {
      lock.unlock();
    }
    LangUtils.debug(log, "Opened {} ({} of {})", transport, getOpenCount(), maxConnections);
    return transport;
  }

  @Override
  public void release(@NonNull final Transport transport) {
    lock.lock();
    try {
      if (!leased.remove(transport)) {
        LangUtils.debug(log, "Ignoring release of {}: not leased", transport);
        return;
      }
      if (!closed && reuseConnections && transport.isReusable() && transport.release()) {
        idle.computeIfAbsent(transport.getEndpoint(), k -> new ArrayDeque<>()).addLast(transport);
      } else {
        open--;
        transport.close();
      }
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void discard(@NonNull final Transport transport) {
    lock.lock();
    try {
      if (leased.remove(transport)) {
        open--;
      } else {
        val q = idle.get(transport.getEndpoint());
        if (q != null && q.remove(transport)) open--;
      }
      transport.close();
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int getIdleCount() {
    lock.lock();
    try {
      int n = 0;
      for (val q : idle.values()) n += q.size();
      return n;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int getLeasedCount() {
    lock.lock();
    try {
      return leased.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int getOpenCount() {
    lock.lock();
    try {
      return open;
    } finally {
      lock.unlock();
    }
  }

  /** Callers queued for a slot. */
  public int getWaitingCount() {
    lock.lock();
    try {
      return waiters.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    lock.lock();
    try {
      if (closed) return;
      closed = true;
      for (val q : idle.values()) {
        for (val t : q) {
          t.close();
          open--;
        }
      }
      idle.clear();
      changed.signalAll();
      LangUtils.debug(log, "Pool closed, {} leased connections still out", leased.size());
    } finally {
      lock.unlock();
    }
  }

  private void freeSlot() {
    lock.lock();
    try {
      open--;
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  private void ensureOpen() throws ConnectionException {
    if (closed) throw new ConnectionException("Connection pool is closed", null);
  }

  /** Most recently used idle transport of {@code endpoint} that is still healthy. */
  private Transport pollIdle(final Endpoint endpoint) {
    val q = idle.get(endpoint);
    if (q == null) return null;
    Transport t;
    while ((t = q.pollLast()) != null) {
      if (t.isReusable() && t.acquireIfIdle()) return t;
      t.close();
      open--;
    }
    return null;
  }

  private boolean evictOtherEndpoint(final Endpoint endpoint) {
    for (val e : idle.entrySet()) {
      if (e.getKey().equals(endpoint)) continue;
      val victim = e.getValue().pollFirst();
      if (victim != null) {
        LangUtils.debug(log, "Evicting idle {} to make room for {}", victim, endpoint);
        victim.close();
        open--;
        return true;
      }
    }
    return false;
  }

  private void expireIdle() {
    val limited = !maxIdle.isZero() && !maxIdle.isNegative();
    for (val q : idle.values()) {
      val it = q.iterator();
      while (it.hasNext()) {
        val t = it.next();
        if (t.isClosed() || (limited && t.getIdleTime().compareTo(maxIdle) > 0)) {
          it.remove();
          t.close();
          open--;
        }
      }
    }
  }
}
