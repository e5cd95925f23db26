package org.folio.xmlstream.util.event;

import io.vertx.core.Handler;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Dispatcher owned by a single protocol instance.
 *
 * <p>Not thread-safe; it is used from the event loop that owns the connection.
 * The observer list is copied before each dispatch, so observers that add or remove
 * observers while being invoked only affect later dispatches.
 */
public class EventDispatcher implements Dispatcher {

  private static final class Registration {
    final Handler<Object> observer;
    final int priority;
    final boolean onetime;

    Registration(Handler<Object> observer, int priority, boolean onetime) {
      this.observer = observer;
      this.priority = priority;
      this.onetime = onetime;
    }
  }

  private final Map<String, List<Registration>> observers = new HashMap<>();

  @Override
  public void addObserver(String selector, Handler<Object> observer, int priority) {
    add(selector, new Registration(observer, priority, false));
  }

  @Override
  public void addOnetimeObserver(String selector, Handler<Object> observer) {
    add(selector, new Registration(observer, 0, true));
  }

  private void add(String selector, Registration registration) {
    if (selector == null || registration.observer == null) {
      throw new IllegalArgumentException("selector and observer must be given");
    }
    List<Registration> list = observers.computeIfAbsent(selector, k -> new ArrayList<>());
    int pos = list.size();
    while (pos > 0 && list.get(pos - 1).priority < registration.priority) {
      pos--;
    }
    list.add(pos, registration);
  }

  @Override
  public void removeObserver(String selector, Handler<Object> observer) {
    List<Registration> list = observers.get(selector);
    if (list == null) {
      return;
    }
    Iterator<Registration> it = list.iterator();
    while (it.hasNext()) {
      if (it.next().observer.equals(observer)) {
        it.remove();
        break;
      }
    }
    if (list.isEmpty()) {
      observers.remove(selector);
    }
  }

  /**
   * Check whether any observer is registered for selector.
   * @param selector event selector
   * @return true if at least one observer is registered
   */
  public boolean hasObservers(String selector) {
    return observers.containsKey(selector);
  }

  @Override
  public void dispatch(Object payload, String selector) {
    List<Registration> list = observers.get(selector);
    if (list == null) {
      return;
    }
    List<Registration> snapshot = new ArrayList<>(list);
    for (Registration registration : snapshot) {
      if (registration.onetime && !removeRegistration(selector, registration)) {
        // already fired from a re-entrant dispatch
        continue;
      }
      registration.observer.handle(payload);
    }
  }

  private boolean removeRegistration(String selector, Registration registration) {
    List<Registration> list = observers.get(selector);
    if (list == null) {
      return false;
    }
    // identity, so that equal observers added twice are told apart
    for (int i = 0; i < list.size(); i++) {
      if (list.get(i) == registration) {
        list.remove(i);
        if (list.isEmpty()) {
          observers.remove(selector);
        }
        return true;
      }
    }
    return false;
  }
}
