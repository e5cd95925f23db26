package org.folio.xmlstream.util.stream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.folio.xmlstream.util.event.Dispatcher;

/**
 * Factory for a pluggable protocol class.
 *
 * <p>Arguments and options are captured when the factory is constructed and passed to
 * the protocol creator for every connection.
 * @param <P> protocol type
 */
public class ParameterizedProtocolFactory<P extends Protocol & Dispatcher>
    extends AbstractProtocolFactory<P> {

  private ProtocolCreator<? extends P> protocol;

  private final List<Object> args;

  private final Map<String, Object> options;

  /**
   * Create factory.
   * @param protocol creator of protocol instances
   * @param args positional arguments; may contain null
   * @param options named options
   */
  public ParameterizedProtocolFactory(ProtocolCreator<? extends P> protocol,
      List<Object> args, Map<String, Object> options) {
    this.protocol = protocol;
    this.args = Collections.unmodifiableList(new ArrayList<>(args));
    this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
  }

  public void setProtocol(ProtocolCreator<? extends P> protocol) {
    this.protocol = protocol;
  }

  public List<Object> getArgs() {
    return args;
  }

  public Map<String, Object> getOptions() {
    return options;
  }

  @Override
  protected P newProtocol() {
    if (protocol == null) {
      throw new IllegalStateException("No protocol set for factory");
    }
    return protocol.create(args, options);
  }
}
