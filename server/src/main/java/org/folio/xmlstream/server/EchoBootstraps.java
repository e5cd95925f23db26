package org.folio.xmlstream.server;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.folio.xmlstream.util.dom.Element;
import org.folio.xmlstream.util.stream.XmlStream;
import org.folio.xmlstream.util.stream.XmlStreamFactory;

/**
 * Bootstraps of the shipped server: every stream answers the peer's stream header with
 * its own and echoes each element it receives.
 */
public final class EchoBootstraps {
  private static final Logger log = LogManager.getLogger(EchoBootstraps.class);

  private EchoBootstraps() { }

  /**
   * Add echo bootstraps to factory.
   * @param factory factory building the streams
   */
  public static void install(XmlStreamFactory factory) {
    factory.addBootstrap(XmlStream.STREAM_CONNECTED_EVENT,
        payload -> initializeStream((XmlStream) payload));
  }

  static void initializeStream(XmlStream xs) {
    xs.addObserver(XmlStream.STREAM_START_EVENT, payload -> {
      Element root = (Element) payload;
      log.debug("Stream start {}", root.getTagName());
      xs.send(root.toStartTag());
    });
    xs.addObserver(XmlStream.ELEMENT_EVENT, payload -> xs.send((Element) payload));
    xs.addObserver(XmlStream.STREAM_ERROR_EVENT, payload -> {
      log.warn("Stream error: {}", ((Throwable) payload).getMessage());
      Element root = xs.getRoot();
      if (root != null) {
        xs.send("</" + root.getTagName() + ">");
      }
    });
    xs.addObserver(XmlStream.STREAM_END_EVENT, payload -> log.debug("Stream end {}",
        payload == null ? "" : ((Throwable) payload).getMessage()));
  }
}
