package org.folio.xmlstream.util.stream;

import io.vertx.core.buffer.Buffer;

/**
 * Connection lifecycle callbacks driven by the connection management layer.
 */
public interface Protocol {

  /**
   * Attach transport and signal that the connection is up.
   * @param transport connection
   */
  void makeConnection(Transport transport);

  void connectionMade();

  /**
   * Bytes received, in arbitrary chunks.
   * @param data chunk
   */
  void dataReceived(Buffer data);

  /**
   * Connection is gone.
   * @param reason cause; null for a clean close
   */
  void connectionLost(Throwable reason);

  ProtocolFactory<?> getFactory();

  void setFactory(ProtocolFactory<?> factory);
}
