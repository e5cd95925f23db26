package org.folio.xmlstream.util.stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.folio.xmlstream.util.event.Bootstraps;
import org.folio.xmlstream.util.event.Dispatcher;

/**
 * Factory that installs its bootstrap observers on every protocol it builds.
 * @param <P> protocol type
 */
public abstract class AbstractProtocolFactory<P extends Protocol & Dispatcher>
    extends Bootstraps implements ProtocolFactory<P> {

  private static final Logger log = LogManager.getLogger(AbstractProtocolFactory.class);

  /**
   * Create a protocol instance; bootstraps are not installed yet.
   * @return new instance
   */
  protected abstract P newProtocol();

  @Override
  public P buildProtocol(ConnectionInfo connectionInfo) {
    P protocol = newProtocol();
    protocol.setFactory(this);
    installBootstraps(protocol);
    log.debug("Built {} for {}", protocol.getClass().getSimpleName(), connectionInfo);
    return protocol;
  }
}
