package org.danilorossi.spamc.transport;

/** Why a transport was closed underneath a blocked read or write. */
public enum AbortReason {
  TIMEOUT,
  CANCELLED
}
