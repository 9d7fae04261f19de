package org.danilorossi.spamc.transport;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.spamc.helpers.LangUtils;
import org.danilorossi.spamc.helpers.LogConfigurator;

/**
 * Enforces exchange deadlines on blocking I/O. When a deadline passes, the transport is aborted,
 * which closes its socket and makes the blocked read or write fail at once.
 */
@Log
public final class DeadlineWatchdog {

  static {
    LogConfigurator.configLog(log);
  }

  private static final DeadlineWatchdog SHARED = new DeadlineWatchdog();

  /** Disarms the deadline; closing twice is harmless. */
  public interface Guard extends AutoCloseable {
    @Override
    void close();
  }

  private final ScheduledExecutorService scheduler;

  private DeadlineWatchdog() {
    this.scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              val t = new Thread(r, "spamc-deadline-watchdog");
              t.setDaemon(true);
              return t;
            });
  }

  public static DeadlineWatchdog shared() {
    return SHARED;
  }

  /**
   * Schedules {@code transport.abort(TIMEOUT)} at {@code deadline}. A deadline already in the past
   * aborts immediately.
   */
  public Guard arm(@NonNull final Transport transport, @NonNull final Instant deadline) {
    val delay = Duration.between(Instant.now(), deadline).toNanos();
    if (delay <= 0) {
      transport.abort(AbortReason.TIMEOUT);
      return () -> {};
    }
    final ScheduledFuture<?> task =
        scheduler.schedule(
            () -> {
              LangUtils.debug(log, "Deadline reached for transport #{}", transport.getId());
              transport.abort(AbortReason.TIMEOUT);
            },
            delay,
            TimeUnit.NANOSECONDS);
    return () -> task.cancel(false);
  }
}
