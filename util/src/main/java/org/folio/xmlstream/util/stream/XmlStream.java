package org.folio.xmlstream.util.stream;

import io.vertx.core.buffer.Buffer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.folio.xmlstream.util.dom.Element;
import org.folio.xmlstream.util.event.EventDispatcher;

/**
 * XML stream protocol: one root element per connection, children dispatched as they
 * complete.
 *
 * <p>Events:
 * <ul>
 *   <li>{@link #STREAM_CONNECTED_EVENT} with this stream, when the connection is made</li>
 *   <li>{@link #STREAM_START_EVENT} with the root {@link Element}</li>
 *   <li>{@link #elementSelector(Element)} then {@link #ELEMENT_EVENT} with each completed
 *   child of the root</li>
 *   <li>{@link #STREAM_ERROR_EVENT} with an {@link XmlParseException}; always followed
 *   by {@link #STREAM_END_EVENT}</li>
 *   <li>{@link #STREAM_END_EVENT} with the reason the stream ended, or null; exactly once</li>
 * </ul>
 *
 * <p>Not thread-safe. All calls must come from the event loop owning the connection.
 * Observers may call back into the stream while being dispatched.
 */
public class XmlStream extends EventDispatcher implements Protocol {

  public static final String STREAM_CONNECTED_EVENT = "stream-connected";
  public static final String STREAM_START_EVENT = "stream-start";
  public static final String STREAM_ERROR_EVENT = "stream-error";
  public static final String STREAM_END_EVENT = "stream-end";
  public static final String ELEMENT_EVENT = "element";

  private static final Logger log = LogManager.getLogger(XmlStream.class);

  private StreamState state = StreamState.IDLE;

  private Transport transport;

  private ProtocolFactory<?> factory;

  private IncrementalXmlParser parser;

  private Element root;

  private final Deque<Buffer> pending = new ArrayDeque<>();

  private boolean receiving;

  /**
   * Selector under which a completed child is dispatched.
   * @param element child of the root
   * @return "/name" or "/{uri}name"
   */
  public static String elementSelector(Element element) {
    return "/" + element.getQName().toString();
  }

  public StreamState getState() {
    return state;
  }

  public Transport getTransport() {
    return transport;
  }

  /**
   * Root element once the stream has started.
   * @return root or null
   */
  public Element getRoot() {
    return root;
  }

  @Override
  public ProtocolFactory<?> getFactory() {
    return factory;
  }

  @Override
  public void setFactory(ProtocolFactory<?> factory) {
    this.factory = factory;
  }

  public void setTransport(Transport transport) {
    this.transport = transport;
  }

  @Override
  public void makeConnection(Transport transport) {
    setTransport(transport);
    connectionMade();
  }

  @Override
  public void connectionMade() {
    if (state != StreamState.IDLE) {
      throw new IllegalStateException("Connection already made; state " + state);
    }
    parser = new IncrementalXmlParser();
    state = StreamState.AWAITING_ROOT;
    log.debug("Connection made");
    dispatch(this, STREAM_CONNECTED_EVENT);
  }

  /**
   * Parse received bytes and dispatch the events they complete.
   *
   * <p>Data received after the stream has ended is ignored. Calls made by observers while
   * a chunk is being processed are queued and handled after it. An observer failure does
   * not stop processing: every event of the chunk and of the queued chunks is still
   * dispatched, then the first failure is thrown with later ones suppressed.
   * @param data chunk
   * @throws IllegalStateException if called before {@link #connectionMade()}
   */
  @Override
  public void dataReceived(Buffer data) {
    if (state == StreamState.IDLE) {
      throw new IllegalStateException("Data received before connection was made");
    }
    if (state == StreamState.ENDED) {
      log.debug("Ignoring {} bytes on ended stream", data.length());
      return;
    }
    pending.add(data);
    if (receiving) {
      return;
    }
    receiving = true;
    RuntimeException observerFailure = null;
    try {
      Buffer chunk;
      while ((chunk = pending.poll()) != null) {
        observerFailure = process(chunk, observerFailure);
      }
    } finally {
      receiving = false;
    }
    if (observerFailure != null) {
      throw observerFailure;
    }
  }

  private static RuntimeException addFailure(RuntimeException first, RuntimeException e) {
    if (first == null) {
      return e;
    }
    if (first != e) {
      first.addSuppressed(e);
    }
    return first;
  }

  private RuntimeException process(Buffer chunk, RuntimeException observerFailure) {
    if (state == StreamState.ENDED) {
      return observerFailure;
    }
    List<ParseEvent> events = parser.feed(chunk);
    for (ParseEvent event : events) {
      if (state == StreamState.ENDED) {
        break;
      }
      try {
        handle(event);
      } catch (RuntimeException e) {
        log.debug("Observer failed on {}: {}", event.getType(), e.getMessage());
        observerFailure = addFailure(observerFailure, e);
      }
    }
    return observerFailure;
  }

  private void handle(ParseEvent event) {
    switch (event.getType()) {
      case ROOT_OPENED:
        onRootOpened(event.getElement());
        break;
      case CHILD_COMPLETED:
        onChildCompleted(event.getElement());
        break;
      case ROOT_CLOSED:
        onRootClosed();
        break;
      case FAILURE:
        onFailure(event.getFailure());
        break;
      default:
        throw new IllegalStateException("Unhandled parse event " + event.getType());
    }
  }

  private void onRootOpened(Element element) {
    root = element;
    state = StreamState.IN_STREAM;
    log.debug("Stream started {}", element.toStartTag());
    dispatch(element, STREAM_START_EVENT);
  }

  private void onChildCompleted(Element element) {
    RuntimeException observerFailure = null;
    try {
      dispatch(element, elementSelector(element));
    } catch (RuntimeException e) {
      observerFailure = e;
    }
    if (state != StreamState.ENDED) {
      try {
        dispatch(element, ELEMENT_EVENT);
      } catch (RuntimeException e) {
        observerFailure = addFailure(observerFailure, e);
      }
    }
    if (observerFailure != null) {
      throw observerFailure;
    }
  }

  private void onRootClosed() {
    log.debug("Root element closed by peer");
    if (transport != null) {
      transport.loseConnection();
    }
  }

  private void onFailure(XmlParseException e) {
    log.debug("Parse failure: {}", e.getMessage());
    state = StreamState.ERRORED;
    RuntimeException observerFailure = null;
    try {
      dispatch(e, STREAM_ERROR_EVENT);
    } catch (RuntimeException ex) {
      observerFailure = ex;
    }
    try {
      end(e);
    } catch (RuntimeException ex) {
      observerFailure = addFailure(observerFailure, ex);
    }
    if (transport != null) {
      transport.loseConnection();
    }
    if (observerFailure != null) {
      throw observerFailure;
    }
  }

  /**
   * Connection is gone. Dispatches {@link #STREAM_END_EVENT} unless the stream has
   * already ended; further calls do nothing.
   * @param reason cause; null for a clean close
   */
  @Override
  public void connectionLost(Throwable reason) {
    if (state == StreamState.ENDED) {
      return;
    }
    log.debug("Connection lost: {}", reason == null ? "closed" : reason.getMessage());
    end(reason);
  }

  private void end(Throwable reason) {
    if (state == StreamState.ENDED) {
      return;
    }
    state = StreamState.ENDED;
    pending.clear();
    dispatch(reason, STREAM_END_EVENT);
  }

  /**
   * Write data verbatim to the transport.
   * @param data text, written as UTF-8
   * @throws IllegalStateException if the connection has not been made
   */
  public void send(String data) {
    send(Buffer.buffer(data));
  }

  /**
   * Serialize element and write it to the transport.
   * @param element element
   * @throws IllegalStateException if the connection has not been made
   */
  public void send(Element element) {
    send(element.toXml());
  }

  /**
   * Write data verbatim to the transport. Data sent after the stream has ended is dropped.
   * @param data bytes
   * @throws IllegalStateException if the connection has not been made
   */
  public void send(Buffer data) {
    if (transport == null || state == StreamState.IDLE) {
      throw new IllegalStateException("Not connected");
    }
    if (state == StreamState.ENDED) {
      log.warn("Dropping {} bytes sent on ended stream", data.length());
      return;
    }
    transport.write(data);
  }
}
