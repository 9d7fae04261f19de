package org.danilorossi.spamc.transport;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.spamc.error.ConnectionException;
import org.danilorossi.spamc.helpers.LangUtils;
import org.danilorossi.spamc.helpers.LogConfigurator;

/** spamd on a local Unix domain stream socket ({@code spamd --socketpath}). */
@Log
@Getter
@EqualsAndHashCode(callSuper = false)
public final class UnixSocketEndpoint extends Endpoint {

  static {
    LogConfigurator.configLog(log);
  }

  private final Path path;

  public UnixSocketEndpoint(@NonNull final Path path) {
    this.path = path.toAbsolutePath().normalize();
  }

  /** Local connects do not block on the network, so the timeout is not applied. */
  @Override
  public Transport connect(@NonNull final Duration connectTimeout) throws ConnectionException {
    if (!Files.exists(path))
      throw new ConnectionException(LangUtils.s("Socket file {} does not exist", path), null);
    SocketChannel channel = null;
    try {
      channel = SocketChannel.open(StandardProtocolFamily.UNIX);
      channel.connect(UnixDomainSocketAddress.of(path));
      LangUtils.debug(log, "Connected to {}", this);
      return new Transport(
          this, Channels.newInputStream(channel), Channels.newOutputStream(channel), channel);
    } catch (IOException | UnsupportedOperationException e) {
      if (channel != null) {
        try {
          channel.close();
        } catch (IOException closeError) {
          e.addSuppressed(closeError);
        }
      }
      throw new ConnectionException(
          LangUtils.s("Cannot connect to {}: {}", this, LangUtils.exMsg(e)), e);
    }
  }

  @Override
  public String toString() {
    return "unix:" + path;
  }
}
