package org.folio.xmlstream.server;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.net.NetServer;
import io.vertx.core.net.NetServerOptions;
import io.vertx.core.net.NetSocket;
import io.vertx.core.net.SocketAddress;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.folio.xmlstream.util.stream.ConnectionInfo;
import org.folio.xmlstream.util.stream.Protocol;
import org.folio.xmlstream.util.stream.ProtocolFactory;

/**
 * TCP server running one protocol instance per accepted connection.
 */
public class XmlStreamServer {
  private static final Logger log = LogManager.getLogger(XmlStreamServer.class);

  private final Vertx vertx;

  private final ProtocolFactory<?> factory;

  private NetServer netServer;

  public XmlStreamServer(Vertx vertx, ProtocolFactory<?> factory) {
    this.vertx = vertx;
    this.factory = factory;
  }

  /**
   * Start listening.
   * @param port TCP port; 0 for any free port
   * @return future with the actual port
   */
  public Future<Integer> listen(int port) {
    return vertx.createNetServer(new NetServerOptions().setPort(port))
        .connectHandler(this::handleConnection)
        .listen()
        .map(server -> {
          netServer = server;
          return server.actualPort();
        });
  }

  /**
   * Stop listening.
   * @return async result
   */
  public Future<Void> close() {
    if (netServer == null) {
      return Future.succeededFuture();
    }
    NetServer server = netServer;
    netServer = null;
    return server.close();
  }

  static String address(SocketAddress address) {
    return address == null ? null : address.toString();
  }

  void handleConnection(NetSocket socket) {
    ConnectionInfo info = new ConnectionInfo(address(socket.localAddress()),
        address(socket.remoteAddress()));
    log.debug("Connection {}", info);
    Protocol protocol = factory.buildProtocol(info);
    socket.closeHandler(v -> protocol.connectionLost(null));
    socket.exceptionHandler(e -> {
      log.warn("Connection {}: {}", info, e.getMessage());
      protocol.connectionLost(e);
      socket.close();
    });
    socket.handler(buffer -> {
      try {
        protocol.dataReceived(buffer);
      } catch (Exception e) {
        log.error("Connection {}: {}", info, e.getMessage(), e);
        protocol.connectionLost(e);
        socket.close();
      }
    });
    protocol.makeConnection(new NetSocketTransport(socket));
  }
}
