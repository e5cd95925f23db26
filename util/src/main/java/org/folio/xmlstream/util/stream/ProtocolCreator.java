package org.folio.xmlstream.util.stream;

import java.util.List;
import java.util.Map;

/**
 * Constructor of a protocol class taking positional arguments and named options.
 * @param <P> protocol type
 */
@FunctionalInterface
public interface ProtocolCreator<P> {

  P create(List<Object> args, Map<String, Object> options);
}
