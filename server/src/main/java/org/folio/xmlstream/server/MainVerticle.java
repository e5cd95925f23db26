package org.folio.xmlstream.server;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.folio.xmlstream.server.misc.SysConf;
import org.folio.xmlstream.util.stream.XmlStreamFactory;

public class MainVerticle extends AbstractVerticle {
  final Logger log = LogManager.getLogger(MainVerticle.class);

  private XmlStreamServer server;

  @Override
  public void start(Promise<Void> promise) {
    final int port = Integer.parseInt(
        SysConf.get("xml.port", "port", "8090", config()));

    XmlStreamFactory factory = new XmlStreamFactory();
    EchoBootstraps.install(factory);

    server = new XmlStreamServer(vertx, factory);
    server.listen(port)
        .onSuccess(actualPort -> log.info("Listening on port {}", actualPort))
        .onComplete(x -> promise.handle(x.mapEmpty()));
  }

  @Override
  public void stop(Promise<Void> promise) {
    server.close().onComplete(promise);
  }
}
