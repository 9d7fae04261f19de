package org.danilorossi.spamc.pool;

import java.time.Instant;
import org.danilorossi.spamc.error.SpamcException;
import org.danilorossi.spamc.transport.Endpoint;
import org.danilorossi.spamc.transport.Transport;

/**
 * Hands out transports with exclusive ownership. Every transport obtained from {@link #acquire}
 * must be given back exactly once, through {@link #release} after a clean exchange or {@link
 * #discard} after any failure.
 */
public interface ConnectionPool extends AutoCloseable {

  /**
   * Returns an IN_USE transport for {@code endpoint}, opening one if allowed.
   *
   * @throws org.danilorossi.spamc.error.ConnectionException the connect failed
   * @throws org.danilorossi.spamc.error.PoolExhaustedException no slot and the policy is FAIL_FAST
   * @throws org.danilorossi.spamc.error.SpamcTimeoutException no slot before {@code deadline}
   */
  Transport acquire(Endpoint endpoint, Instant deadline) throws SpamcException;

  /** Returns the transport after a complete exchange; it is pooled or closed. */
  void release(Transport transport);

  /** Closes the transport and frees its slot. */
  void discard(Transport transport);

  int getIdleCount();

  int getLeasedCount();

  /** Idle, leased and connecting transports together. */
  int getOpenCount();

  /** Closes idle transports and rejects further acquisitions. Leased ones close on return. */
  @Override
  void close();
}
