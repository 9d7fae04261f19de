package org.danilorossi.spamc.pool;

/** What {@link ConnectionPool#acquire} does when every connection slot is taken. */
public enum PoolPolicy {
  /** Queue in arrival order until a slot frees up or the exchange deadline passes. */
  WAIT,
  /** Fail at once with {@link org.danilorossi.spamc.error.PoolExhaustedException}. */
  FAIL_FAST
}
