package org.danilorossi.spamc.transport;

/** Lifecycle of a pooled connection. CLOSED is terminal. */
public enum TransportState {
  IDLE,
  IN_USE,
  CLOSED
}
