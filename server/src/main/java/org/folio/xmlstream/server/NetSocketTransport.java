package org.folio.xmlstream.server;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.net.NetSocket;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.folio.xmlstream.util.stream.Transport;

/**
 * Transport backed by a Vert.x socket.
 */
public class NetSocketTransport implements Transport {
  private static final Logger log = LogManager.getLogger(NetSocketTransport.class);

  private final NetSocket socket;

  public NetSocketTransport(NetSocket socket) {
    this.socket = socket;
  }

  @Override
  public void write(Buffer data) {
    socket.write(data)
        .onFailure(e -> log.warn("Write to {} failed: {}", socket.remoteAddress(), e.getMessage()));
  }

  @Override
  public void loseConnection() {
    socket.close();
  }
}
