package org.folio.xmlstream.util.event;

import io.vertx.core.Handler;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of observers that are installed on every dispatcher given to
 * {@link #installBootstraps(Dispatcher)}.
 *
 * <p>Installing copies the registrations; the list itself is kept and can be installed
 * again on other dispatchers.
 */
public class Bootstraps {

  private final List<Map.Entry<String, Handler<Object>>> bootstraps = new ArrayList<>();

  /**
   * Add bootstrap observer.
   * @param selector event selector
   * @param observer handler
   */
  public void addBootstrap(String selector, Handler<Object> observer) {
    if (selector == null || observer == null) {
      throw new IllegalArgumentException("selector and observer must be given");
    }
    bootstraps.add(Map.entry(selector, observer));
  }

  /**
   * Remove first matching bootstrap; nothing happens if there is no match.
   * @param selector event selector
   * @param observer handler
   */
  public void removeBootstrap(String selector, Handler<Object> observer) {
    Iterator<Map.Entry<String, Handler<Object>>> it = bootstraps.iterator();
    while (it.hasNext()) {
      Map.Entry<String, Handler<Object>> entry = it.next();
      if (entry.getKey().equals(selector) && entry.getValue().equals(observer)) {
        it.remove();
        return;
      }
    }
  }

  /**
   * Register all bootstrap observers on dispatcher, in the order they were added.
   *
   * <p>Installing twice on the same dispatcher registers everything twice.
   * @param dispatcher target
   */
  public void installBootstraps(Dispatcher dispatcher) {
    for (Map.Entry<String, Handler<Object>> entry : bootstraps) {
      dispatcher.addObserver(entry.getKey(), entry.getValue());
    }
  }

  public List<Map.Entry<String, Handler<Object>>> getBootstraps() {
    return Collections.unmodifiableList(new ArrayList<>(bootstraps));
  }
}
