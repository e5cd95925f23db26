package org.folio.xmlstream.util.stream;

import io.vertx.core.buffer.Buffer;

/**
 * What a protocol needs from the connection it runs on.
 */
public interface Transport {

  void write(Buffer data);

  /**
   * Close the connection. The protocol is told through
   * {@link Protocol#connectionLost(Throwable)} once the connection is gone.
   */
  void loseConnection();
}
