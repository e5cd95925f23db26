package org.folio.xmlstream.util.stream;

public interface ProtocolFactory<P extends Protocol> {

  /**
   * Create protocol instance for a new connection.
   * @param connectionInfo connection addresses; may be null
   * @return new protocol instance
   */
  P buildProtocol(ConnectionInfo connectionInfo);
}
